package com.lipid.advisor.main;

import com.lipid.advisor.client.FhirClient;
import com.lipid.advisor.client.FhirPatientStateMapper;
import com.lipid.advisor.evaluator.ClinicalDecisionEngine;
import com.lipid.advisor.evidence.EvidenceIds;
import com.lipid.advisor.evidence.EvidenceTable;
import com.lipid.advisor.model.AnnotationResult;
import com.lipid.advisor.model.PatientResources;
import com.lipid.advisor.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Command-line entry point for the lipid management advisor.
 * Annotates clinical narrative files and/or FHIR patients in parallel and prints a report.
 * <pre>
 * LipidAdvisorApp [--fhir &lt;patientId&gt;]... [--server &lt;url&gt;] [--threads &lt;n&gt;] [--json] [file...]
 * </pre>
 * With no files and no FHIR patients, a single narrative is read from standard input.
 */
public class LipidAdvisorApp {

    private static final Logger logger = LoggerFactory.getLogger(LipidAdvisorApp.class);
    private static final int DEFAULT_THREAD_POOL_SIZE = 4;

    static final String USAGE =
        "Usage: LipidAdvisorApp [--fhir <patientId>]... [--server <url>] [--threads <n>] [--json] [file...]";

    public static void main(String[] args) {
        logger.info("Starting lipid management advisor");

        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        try {
            EvidenceTable evidence = EvidenceTable.loadDefault();
            evidence.requireAll(EvidenceIds.all());

            ClinicalDecisionEngine engine = new ClinicalDecisionEngine();
            ReportGenerator reportGenerator = new ReportGenerator(evidence);

            List<Supplier<AnnotationResult>> tasks = buildTasks(options, engine);
            logger.info("Annotating {} inputs on {} threads", tasks.size(), options.getThreads());

            List<AnnotationResult> results = processInParallel(tasks, options.getThreads());
            logger.info("Completed annotation of {}/{} inputs", results.size(), tasks.size());

            System.out.println(options.isJson()
                ? reportGenerator.generateStructuredReport(results)
                : reportGenerator.generateReport(results));

            logger.info("Lipid management advisor completed successfully");

        } catch (Exception e) {
            logger.error("Fatal error in lipid advisor application: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * One task per input: narrative files first, then FHIR patients. Standard input is
     * read only when neither is given.
     */
    static List<Supplier<AnnotationResult>> buildTasks(Options options, ClinicalDecisionEngine engine) {
        List<Supplier<AnnotationResult>> tasks = new ArrayList<>();

        for (Path file : options.getFiles()) {
            tasks.add(() -> engine.annotate(file.getFileName().toString(), readNarrative(file)));
        }

        if (!options.getFhirPatientIds().isEmpty()) {
            FhirClient fhirClient = options.getServerUrl() != null
                ? new FhirClient(options.getServerUrl())
                : new FhirClient();
            FhirPatientStateMapper mapper = new FhirPatientStateMapper();
            for (String patientId : options.getFhirPatientIds()) {
                tasks.add(() -> {
                    PatientResources resources = fhirClient.getPatientResources(patientId);
                    return engine.assess("Patient/" + patientId,
                        mapper.toPatientState(resources), mapper.toRiskProfile(resources));
                });
            }
        }

        if (tasks.isEmpty()) {
            String narrative = readStandardInput();
            tasks.add(() -> engine.annotate("stdin", narrative));
        }
        return tasks;
    }

    private static String readNarrative(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read narrative " + file, e);
        }
    }

    private static String readStandardInput() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read narrative from standard input", e);
        }
    }

    /**
     * Run annotation tasks in parallel using CompletableFuture on a fixed thread pool.
     * A failed task is logged and left out of the results.
     * @param tasks Annotation tasks
     * @param threads Thread pool size
     * @return Results of the tasks that succeeded, in task order
     */
    static List<AnnotationResult> processInParallel(List<Supplier<AnnotationResult>> tasks, int threads) {
        ExecutorService executorService = Executors.newFixedThreadPool(threads);

        AtomicInteger processedCount = new AtomicInteger(0);
        int total = tasks.size();

        try {
            List<CompletableFuture<AnnotationResult>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> {
                    int currentCount = processedCount.incrementAndGet();
                    try {
                        AnnotationResult result = task.get();
                        logger.info("Input {}/{} {}: risk={}, NHI eligible={}", currentCount, total,
                            result.getSourceId(), result.getRiskAssessment().getCategory().getId(),
                            result.getEligibility().isEligible());
                        return result;
                    } catch (Exception e) {
                        logger.error("Error processing input {}/{}: {}", currentCount, total, e.getMessage(), e);
                        return null;
                    }
                }, executorService))
                .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            return futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        } finally {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Executor service did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.error("Interrupted while waiting for executor service to terminate");
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Parsed command-line arguments
     */
    static final class Options {
        private final List<Path> files = new ArrayList<>();
        private final List<String> fhirPatientIds = new ArrayList<>();
        private String serverUrl;
        private int threads = DEFAULT_THREAD_POOL_SIZE;
        private boolean json;

        /**
         * @param args Command-line arguments
         * @return Parsed options
         * @throws IllegalArgumentException on a missing option value or a non-positive thread count
         */
        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--fhir" -> options.fhirPatientIds.add(valueAfter(args, ++i, arg));
                    case "--server" -> options.serverUrl = valueAfter(args, ++i, arg);
                    case "--threads" -> options.threads = parseThreads(valueAfter(args, ++i, arg));
                    case "--json" -> options.json = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        options.files.add(Path.of(arg));
                    }
                }
            }
            return options;
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int parseThreads(String value) {
            try {
                int threads = Integer.parseInt(value);
                if (threads <= 0) {
                    throw new IllegalArgumentException("Thread count must be positive: " + value);
                }
                return threads;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid thread count: " + value, e);
            }
        }

        List<Path> getFiles() {
            return files;
        }

        List<String> getFhirPatientIds() {
            return fhirPatientIds;
        }

        String getServerUrl() {
            return serverUrl;
        }

        int getThreads() {
            return threads;
        }

        boolean isJson() {
            return json;
        }
    }
}
