package com.lipid.advisor.model;

import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Procedure;

import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Raw FHIR R4 resources fetched for one patient, before mapping to a PatientState
 */
public class PatientResources {
    private static final String LOINC_SYSTEM = "http://loinc.org";

    private String patientId;
    private Patient patient;
    private List<Condition> conditions;
    private List<Observation> observations;
    private List<MedicationStatement> medications;
    private List<Procedure> procedures;

    public PatientResources() {
        this(null, null, null, null, null, null);
    }

    public PatientResources(String patientId, Patient patient, List<Condition> conditions,
                            List<Observation> observations, List<MedicationStatement> medications,
                            List<Procedure> procedures) {
        this.patientId = patientId;
        this.patient = patient;
        setConditions(conditions);
        setObservations(observations);
        setMedications(medications);
        setProcedures(procedures);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }

    /**
     * Whole years between the birth date and today, in the system time zone
     */
    public Optional<Integer> getAge() {
        return Optional.ofNullable(patient)
                .filter(Patient::hasBirthDate)
                .map(p -> p.getBirthDate().toInstant().atZone(ZoneId.systemDefault()).toLocalDate())
                .map(born -> Period.between(born, LocalDate.now()).getYears());
    }

    /**
     * Newest observation coded with any of the LOINC codes; undated ones lose to dated ones
     */
    public Optional<Observation> getLatestObservation(String... loincCodes) {
        List<String> codes = Arrays.asList(loincCodes);
        return observations.stream()
                .filter(obs -> hasLoincCode(obs, codes))
                .max(Comparator.comparingLong(PatientResources::effectiveTime));
    }

    private static long effectiveTime(Observation observation) {
        if (observation.hasEffectiveDateTimeType() && observation.getEffectiveDateTimeType().getValue() != null) {
            return observation.getEffectiveDateTimeType().getValue().getTime();
        }
        return Long.MIN_VALUE;
    }

    private static boolean hasLoincCode(Observation observation, List<String> loincCodes) {
        return observation.hasCode() && observation.getCode().getCoding().stream()
                .anyMatch(c -> LOINC_SYSTEM.equals(c.getSystem()) && loincCodes.contains(c.getCode()));
    }

    /**
     * Flatten a codeable concept into its text and coding displays, space separated
     * @param concept The concept, may be null
     * @return Concatenated human-readable text
     */
    public static String describe(CodeableConcept concept) {
        if (concept == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        if (concept.hasText()) {
            text.append(concept.getText());
        }
        for (var coding : concept.getCoding()) {
            if (coding.hasDisplay()) {
                text.append(' ').append(coding.getDisplay());
            }
        }
        return text.toString().trim();
    }

    /**
     * @return true when any coding of the concept carries one of the codes
     */
    public static boolean hasAnyCode(CodeableConcept concept, List<String> codes) {
        if (concept == null || !concept.hasCoding()) {
            return false;
        }
        return concept.getCoding().stream()
                .anyMatch(coding -> coding.hasCode() && codes.contains(coding.getCode()));
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public Patient getPatient() {
        return patient;
    }

    public void setPatient(Patient patient) {
        this.patient = patient;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = orEmpty(conditions);
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public void setObservations(List<Observation> observations) {
        this.observations = orEmpty(observations);
    }

    public List<MedicationStatement> getMedications() {
        return medications;
    }

    public void setMedications(List<MedicationStatement> medications) {
        this.medications = orEmpty(medications);
    }

    public List<Procedure> getProcedures() {
        return procedures;
    }

    public void setProcedures(List<Procedure> procedures) {
        this.procedures = orEmpty(procedures);
    }
}
