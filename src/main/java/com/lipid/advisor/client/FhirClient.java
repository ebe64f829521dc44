package com.lipid.advisor.client;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.rest.client.api.IGenericClient;
import ca.uhn.fhir.rest.client.exceptions.FhirClientConnectionException;
import ca.uhn.fhir.rest.server.exceptions.ResourceNotFoundException;
import com.lipid.advisor.model.PatientResources;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Procedure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Read-only access to a FHIR R4 server for everything a lipid assessment looks at:
 * the Patient, its Conditions, Observations (lipids, eGFR, vitals, smoking),
 * MedicationStatements and Procedures. Transient failures are retried with backoff,
 * result sets are followed page by page, and a fetch that cannot complete fails
 * with {@link FhirFetchException}.
 */
public class FhirClient {
    private static final Logger logger = LoggerFactory.getLogger(FhirClient.class);

    public static final String DEFAULT_FHIR_SERVER_URL = "https://hapi.fhir.org/baseR4";
    public static final String SERVER_URL_PROPERTY = "lipid.advisor.fhir.url";

    private static final int MAX_ATTEMPTS = 3;
    private static final long[] DEFAULT_BACKOFF_MS = {1000, 2000};
    private static final int PAGE_SIZE = 100;

    private final IGenericClient client;
    private final String serverUrl;
    private final long[] backoffMs;

    /**
     * Connects to the URL in the {@code lipid.advisor.fhir.url} system property,
     * falling back to the public HAPI test server.
     */
    public FhirClient() {
        this(System.getProperty(SERVER_URL_PROPERTY, DEFAULT_FHIR_SERVER_URL));
    }

    public FhirClient(String serverUrl) {
        this(serverUrl, DEFAULT_BACKOFF_MS);
    }

    /**
     * @param backoffMs wait before each retry; needs at least {@code MAX_ATTEMPTS - 1} entries
     */
    FhirClient(String serverUrl, long[] backoffMs) {
        if (serverUrl == null || serverUrl.isBlank()) {
            throw new IllegalArgumentException("Server URL cannot be empty");
        }
        if (backoffMs == null || backoffMs.length < MAX_ATTEMPTS - 1) {
            throw new IllegalArgumentException("Need a backoff delay for each of " + (MAX_ATTEMPTS - 1) + " retries");
        }
        this.serverUrl = serverUrl;
        this.backoffMs = backoffMs.clone();
        this.client = FhirContext.forR4().newRestfulGenericClient(serverUrl);
        logger.info("Using FHIR server {}", serverUrl);
    }

    /**
     * Fetches one patient's resources. The fetch is all or nothing: an unknown patient,
     * or a read, search or page that still fails after its retries, aborts it.
     * @throws IllegalArgumentException if the id is null or blank
     * @throws FhirFetchException if any part of the record could not be retrieved
     */
    public PatientResources getPatientResources(String patientId) {
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalArgumentException("Patient ID cannot be empty");
        }
        logger.info("Fetching lipid-relevant resources for patient {}", patientId);

        PatientResources resources = new PatientResources();
        resources.setPatientId(patientId);
        resources.setPatient(getPatient(patientId));
        resources.setConditions(getConditions(patientId));
        resources.setObservations(getObservations(patientId));
        resources.setMedications(getMedications(patientId));
        resources.setProcedures(getProcedures(patientId));

        logger.info("Patient {}: {} conditions, {} observations, {} medications, {} procedures",
                patientId, resources.getConditions().size(), resources.getObservations().size(),
                resources.getMedications().size(), resources.getProcedures().size());
        return resources;
    }

    private Patient getPatient(String patientId) {
        return withRetry("read Patient/" + patientId, () -> client.read()
                .resource(Patient.class)
                .withId(patientId)
                .execute());
    }

    private List<Condition> getConditions(String patientId) {
        return collect(Condition.class, patientId, () -> client.search()
                .forResource(Condition.class)
                .where(Condition.PATIENT.hasId(patientId))
                .count(PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute());
    }

    // Lipid panels, eGFR and blood pressure sit under different categories, so no category filter
    private List<Observation> getObservations(String patientId) {
        return collect(Observation.class, patientId, () -> client.search()
                .forResource(Observation.class)
                .where(Observation.PATIENT.hasId(patientId))
                .sort().descending("date")
                .count(PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute());
    }

    private List<MedicationStatement> getMedications(String patientId) {
        return collect(MedicationStatement.class, patientId, () -> client.search()
                .forResource(MedicationStatement.class)
                .where(MedicationStatement.PATIENT.hasId(patientId))
                .where(MedicationStatement.STATUS.exactly().codes("active", "intended", "on-hold"))
                .count(PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute());
    }

    private List<Procedure> getProcedures(String patientId) {
        return collect(Procedure.class, patientId, () -> client.search()
                .forResource(Procedure.class)
                .where(Procedure.PATIENT.hasId(patientId))
                .count(PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute());
    }

    /**
     * Runs a patient-scoped search and drains every page of the result set.
     * A search or page that fails after its retries aborts the whole collection.
     */
    private <T extends IBaseResource> List<T> collect(Class<T> type, String patientId, Supplier<Bundle> search) {
        return collect(type, type.getSimpleName() + " for patient " + patientId, search,
                current -> client.loadPage().next(current).execute());
    }

    <T extends IBaseResource> List<T> collect(Class<T> type, String label, Supplier<Bundle> search,
                                              UnaryOperator<Bundle> nextPage) {
        List<T> found = new ArrayList<>();

        Bundle page = withRetry("search " + label, search);
        int pages = 0;
        while (page != null) {
            pages++;
            page.getEntry().stream()
                    .filter(Bundle.BundleEntryComponent::hasResource)
                    .map(Bundle.BundleEntryComponent::getResource)
                    .filter(type::isInstance)
                    .map(type::cast)
                    .forEach(found::add);

            Bundle current = page;
            Bundle.BundleLinkComponent next = current.getLink(Bundle.LINK_NEXT);
            page = (next != null && next.hasUrl())
                    ? withRetry("page " + (pages + 1) + " of " + label, () -> nextPage.apply(current))
                    : null;
        }

        logger.debug("Collected {} {} resources over {} page(s)", found.size(), label, pages);
        return found;
    }

    /**
     * Calls the server up to {@value #MAX_ATTEMPTS} times, backing off between attempts.
     * A missing resource is not retried.
     * @return the call's result, never null
     * @throws FhirFetchException when the resource is absent, every attempt failed,
     *         or the wait between attempts was interrupted
     */
    <T> T withRetry(String action, Supplier<T> call) {
        RuntimeException failure = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                T result = call.get();
                if (result == null) {
                    throw new FhirFetchException("Server returned nothing for '" + action + "'");
                }
                return result;
            } catch (ResourceNotFoundException e) {
                throw new FhirFetchException("Server has no result for '" + action + "'", e);
            } catch (FhirFetchException e) {
                throw e;
            } catch (FhirClientConnectionException e) {
                failure = e;
                logger.warn("Cannot reach server for '{}' (attempt {}/{}): {}", action, attempt, MAX_ATTEMPTS, e.getMessage());
            } catch (RuntimeException e) {
                failure = e;
                logger.warn("'{}' failed (attempt {}/{}): {}", action, attempt, MAX_ATTEMPTS, e.getMessage());
            }

            if (attempt < MAX_ATTEMPTS) {
                backOff(attempt, action);
            }
        }

        throw new FhirFetchException("Giving up on '" + action + "' after " + MAX_ATTEMPTS + " attempts", failure);
    }

    private void backOff(int attempt, String action) {
        long delayMs = backoffMs[attempt - 1];
        logger.info("Waiting {} ms before retrying '{}'", delayMs, action);
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FhirFetchException("Interrupted while waiting to retry '" + action + "'", e);
        }
    }

    public String getServerUrl() {
        return serverUrl;
    }
}
