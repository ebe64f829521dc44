package com.lipid.advisor.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lipid.advisor.evidence.EvidenceIds;
import com.lipid.advisor.evidence.EvidenceReference;
import com.lipid.advisor.evidence.EvidenceTable;
import com.lipid.advisor.model.AnnotationResult;
import com.lipid.advisor.model.ClinicalFlag;
import com.lipid.advisor.model.EligibilityResult;
import com.lipid.advisor.model.LipidTarget;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.RiskAssessment;
import com.lipid.advisor.model.RiskCategory;
import com.lipid.advisor.model.RiskFactorMatch;
import com.lipid.advisor.model.Sex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generates formatted lipid management reports, citing guideline and reimbursement
 * evidence resolved against the evidence table
 */
public class ReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReportGenerator.class);

    private static final String SEPARATOR = "================================================================================";
    private static final String SUB_SEPARATOR = "--------------------------------------------------------------------------------";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    // Lp(a) above this level is a risk-enhancing factor, mg/dL
    static final double LPA_RISK_ENHANCER_MGDL = 50;

    private final EvidenceTable evidence;
    private final ObjectMapper mapper;

    public ReportGenerator(EvidenceTable evidence) {
        if (evidence == null) {
            throw new IllegalArgumentException("EvidenceTable cannot be null");
        }
        this.evidence = evidence;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Generate complete report for all annotated inputs
     * @param results List of annotation results
     * @return Formatted report string
     */
    public String generateReport(List<AnnotationResult> results) {
        if (results == null || results.isEmpty()) {
            return "No patients assessed.";
        }

        StringBuilder report = new StringBuilder();

        report.append(SEPARATOR).append("\n");
        report.append("LIPID MANAGEMENT DECISION SUPPORT REPORT\n");
        report.append("Risk: ESC/EAS 2025 | Reimbursement: Taiwan NHI\n");
        report.append("Date: ").append(LocalDate.now().format(DATE_FORMATTER)).append("\n");
        report.append(SEPARATOR).append("\n\n");

        for (AnnotationResult result : results) {
            report.append(formatAnnotation(result));
            report.append("\n").append(SUB_SEPARATOR).append("\n\n");
        }

        report.append(generateSummary(results));
        report.append(SEPARATOR).append("\n");

        return report.toString();
    }

    /**
     * Format one annotation: patient state, risk category with target, reimbursement verdict
     * and, for lipid-related inputs, the cited evidence
     * @param result Annotation result
     * @return Formatted section
     */
    public String formatAnnotation(AnnotationResult result) {
        StringBuilder sb = new StringBuilder();

        if (result.getSourceId() != null) {
            sb.append("Source: ").append(result.getSourceId()).append("\n");
        }
        sb.append(formatPatient(result.getState()));
        sb.append("\n");

        RiskAssessment risk = result.getRiskAssessment();
        sb.append("Cardiovascular Risk: ").append(formatCategory(risk.getCategory())).append("\n");
        for (String reason : risk.getReasons()) {
            sb.append("  - ").append(reason).append("\n");
        }
        LipidTarget target = risk.getLipidTarget();
        if (target.isDefined()) {
            sb.append("  LDL-C target: ").append(formatTarget(target)).append("\n");
        } else {
            sb.append("  LDL-C target: none mandated; individualise\n");
        }

        if (hasElevatedLipoproteinA(result)) {
            sb.append("  Note: Lp(a) ").append(formatNumber(result.getRiskProfile().getLipoproteinA().get()))
              .append(" mg/dL (>50) is a risk-enhancing factor; category unchanged.\n");
        }
        sb.append("\n");

        sb.append(formatEligibility(result.getEligibility()));

        Set<String> citedIds = citedEvidence(result);
        if (result.isLipidTopic() && !citedIds.isEmpty()) {
            sb.append("\nEvidence:\n");
            for (String id : citedIds) {
                sb.append(formatEvidence(id));
            }
        }

        return sb.toString();
    }

    /**
     * Evidence ids cited by a result: the LDL-C target, the Lp(a) note and the reimbursement rule
     */
    private Set<String> citedEvidence(AnnotationResult result) {
        Set<String> citedIds = new LinkedHashSet<>();
        result.getRiskAssessment().getLipidTarget().getEvidenceId().ifPresent(citedIds::add);
        if (hasElevatedLipoproteinA(result)) {
            citedIds.add(EvidenceIds.ESC_LPA_RISK_ENHANCER);
        }
        result.getEligibility().getRuleEvidenceId().ifPresent(citedIds::add);
        return citedIds;
    }

    private boolean hasElevatedLipoproteinA(AnnotationResult result) {
        Optional<Double> lpa = result.getRiskProfile().getLipoproteinA();
        return lpa.isPresent() && lpa.get() > LPA_RISK_ENHANCER_MGDL;
    }

    private String formatPatient(PatientState state) {
        StringBuilder sb = new StringBuilder();
        sb.append("Patient: age ").append(state.getAge().map(String::valueOf).orElse("unknown"));
        sb.append(", sex ").append(state.getSex() == Sex.UNKNOWN ? "unknown" : state.getSex().name());
        sb.append(", LDL-C ").append(state.getLdlMgdl().map(ldl -> formatNumber(ldl) + " mg/dL").orElse("unknown"));
        sb.append("\n");

        if (!state.getFlags().isEmpty()) {
            sb.append("Findings: ");
            sb.append(String.join(", ", state.getFlags().stream().map(ClinicalFlag::getLabel).toList()));
            sb.append("\n");
        }
        return sb.toString();
    }

    private String formatEligibility(EligibilityResult eligibility) {
        StringBuilder sb = new StringBuilder();
        sb.append("NHI Reimbursement: ").append(eligibility.isEligible() ? "ELIGIBLE" : "NOT ELIGIBLE");
        sb.append(" (").append(eligibility.getPreventionCategory().getId());
        eligibility.getThresholdMgdl().ifPresent(t -> sb.append(", start at LDL-C ≥").append(t));
        eligibility.getGoalMgdl().ifPresent(g -> sb.append(", goal <").append(g));
        sb.append(")\n");

        sb.append("  Risk factors (").append(eligibility.getRiskFactorCount()).append(")");
        if (!eligibility.getMatchedRiskFactors().isEmpty()) {
            sb.append(": ").append(String.join(", ",
                eligibility.getMatchedRiskFactors().stream().map(RiskFactorMatch::getLabel).toList()));
        }
        sb.append("\n");

        for (String sentence : eligibility.getRationale()) {
            sb.append("  ✓ ").append(sentence).append("\n");
        }
        if (!eligibility.getReminders().isEmpty()) {
            sb.append("  Reminders:\n");
            for (String reminder : eligibility.getReminders()) {
                sb.append("    - ").append(reminder).append("\n");
            }
        }
        return sb.toString();
    }

    private String formatEvidence(String id) {
        Optional<EvidenceReference> reference = evidence.find(id);
        if (reference.isEmpty()) {
            logger.warn("Evidence id {} not found in evidence table", id);
            return "  [" + id + "] (not in evidence table)\n";
        }

        EvidenceReference ref = reference.get();
        StringBuilder sb = new StringBuilder();
        sb.append("  [").append(id).append("] ").append(ref.citation()).append("\n");
        ref.getQuote().ifPresent(quote -> sb.append("      \"").append(quote).append("\"\n"));
        if (ref.getQuote().isEmpty()) {
            ref.getSummary().ifPresent(summary -> sb.append("      ").append(summary).append("\n"));
            ref.getNote().ifPresent(note -> sb.append("      Note: ").append(note).append("\n"));
        }
        return sb.toString();
    }

    private String formatTarget(LipidTarget target) {
        StringBuilder sb = new StringBuilder();
        target.getLdlMgdl().ifPresent(ldl -> sb.append("<").append(ldl).append(" mg/dL"));
        target.getPercentReduction().ifPresent(pct -> {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append("≥").append(pct).append("% reduction from baseline");
        });
        return sb.toString();
    }

    private String formatCategory(RiskCategory category) {
        return switch (category) {
            case VERY_HIGH -> "VERY HIGH";
            case HIGH -> "HIGH";
            case MODERATE -> "MODERATE";
            case LOW -> "LOW";
        };
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * Generate a structured JSON report of all annotated inputs
     * @param results List of annotation results
     * @return JSON string, "{}" when there is nothing to report
     */
    public String generateStructuredReport(List<AnnotationResult> results) {
        if (results == null || results.isEmpty()) {
            return "{}";
        }

        ObjectNode root = mapper.createObjectNode();
        root.put("date", LocalDate.now().format(DATE_FORMATTER));

        ArrayNode patients = root.putArray("patients");
        for (AnnotationResult result : results) {
            patients.add(toJson(result));
        }

        ObjectNode summary = root.putObject("summary");
        summary.put("total", results.size());
        ObjectNode byCategory = summary.putObject("riskCategories");
        for (RiskCategory category : RiskCategory.values()) {
            byCategory.put(category.getId(), results.stream()
                    .filter(r -> r.getRiskAssessment().getCategory() == category)
                    .count());
        }
        summary.put("nhiEligible", results.stream().filter(r -> r.getEligibility().isEligible()).count());
        summary.put("ldlMissing", results.stream().filter(r -> r.getEligibility().getLdlMgdl().isEmpty()).count());

        try {
            return mapper.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render structured report", e);
        }
    }

    private ObjectNode toJson(AnnotationResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("source", result.getSourceId());

        PatientState state = result.getState();
        ObjectNode patient = node.putObject("patient");
        patient.put("age", state.getAge().orElse(null));
        patient.put("sex", state.getSex().name());
        patient.put("ldlMgdl", state.getLdlMgdl().orElse(null));
        ArrayNode flags = patient.putArray("flags");
        state.getFlags().forEach(flag -> flags.add(flag.name()));

        RiskAssessment risk = result.getRiskAssessment();
        ObjectNode riskNode = node.putObject("risk");
        riskNode.put("category", risk.getCategory().getId());
        ArrayNode reasons = riskNode.putArray("reasons");
        risk.getReasons().forEach(reasons::add);
        riskNode.put("ldlTargetMgdl", risk.getLipidTarget().getLdlMgdl().orElse(null));
        riskNode.put("percentReduction", risk.getLipidTarget().getPercentReduction().orElse(null));
        riskNode.put("lipoproteinARiskEnhancer", hasElevatedLipoproteinA(result));

        EligibilityResult eligibility = result.getEligibility();
        ObjectNode eligibilityNode = node.putObject("eligibility");
        eligibilityNode.put("preventionCategory", eligibility.getPreventionCategory().getId());
        eligibilityNode.put("eligible", eligibility.isEligible());
        eligibilityNode.put("ldlMgdl", eligibility.getLdlMgdl().orElse(null));
        eligibilityNode.put("thresholdMgdl", eligibility.getThresholdMgdl().orElse(null));
        eligibilityNode.put("goalMgdl", eligibility.getGoalMgdl().orElse(null));
        ArrayNode riskFactors = eligibilityNode.putArray("riskFactors");
        eligibility.getMatchedRiskFactors().forEach(rf -> riskFactors.add(rf.getId()));
        ArrayNode rationale = eligibilityNode.putArray("rationale");
        eligibility.getRationale().forEach(rationale::add);
        ArrayNode reminders = eligibilityNode.putArray("reminders");
        eligibility.getReminders().forEach(reminders::add);

        ArrayNode evidenceIds = node.putArray("evidence");
        if (result.isLipidTopic()) {
            citedEvidence(result).forEach(evidenceIds::add);
        }
        return node;
    }

    /**
     * Generate summary statistics for all results
     * @param results List of annotation results
     * @return Formatted summary string
     */
    private String generateSummary(List<AnnotationResult> results) {
        StringBuilder sb = new StringBuilder();

        sb.append(SEPARATOR).append("\n");
        sb.append("SUMMARY\n");
        sb.append(SEPARATOR).append("\n\n");

        Map<RiskCategory, Integer> byCategory = new EnumMap<>(RiskCategory.class);
        for (AnnotationResult result : results) {
            byCategory.merge(result.getRiskAssessment().getCategory(), 1, Integer::sum);
        }
        long eligible = results.stream()
                .filter(r -> r.getEligibility().isEligible())
                .count();
        long missingLdl = results.stream()
                .filter(r -> r.getEligibility().getLdlMgdl().isEmpty())
                .count();

        sb.append("Total Patients Assessed: ").append(results.size()).append("\n");
        for (RiskCategory category : RiskCategory.values()) {
            sb.append("  - ").append(formatCategory(category)).append(" risk: ")
              .append(byCategory.getOrDefault(category, 0)).append("\n");
        }
        sb.append("NHI Reimbursement Eligible: ").append(eligible).append("\n");
        if (missingLdl > 0) {
            sb.append("LDL-C Missing (eligibility undetermined): ").append(missingLdl).append("\n");
        }

        return sb.toString();
    }
}
