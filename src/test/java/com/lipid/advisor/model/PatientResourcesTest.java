package com.lipid.advisor.model;

import org.hl7.fhir.r4.model.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientResources convenience methods
 */
public class PatientResourcesTest {

    // ========== getAge() Tests ==========

    @Test
    public void testGetAge_ValidBirthDate() {
        PatientResources resources = new PatientResources();
        resources.setPatient(createPatient(LocalDate.now().minusYears(54)));

        Optional<Integer> age = resources.getAge();
        assertTrue(age.isPresent());
        assertEquals(54, age.get());
    }

    @Test
    public void testGetAge_DayBeforeBirthday() {
        PatientResources resources = new PatientResources();
        resources.setPatient(createPatient(LocalDate.now().minusYears(45).plusDays(1)));

        assertEquals(44, resources.getAge().orElseThrow());
    }

    @Test
    public void testGetAge_NoBirthDate() {
        PatientResources resources = new PatientResources();
        resources.setPatient(new Patient());

        assertFalse(resources.getAge().isPresent());
    }

    @Test
    public void testGetAge_NoPatient() {
        assertFalse(new PatientResources().getAge().isPresent());
    }

    // ========== getLatestObservation() Tests ==========

    @Test
    public void testGetLatestObservation_NewestWins() {
        PatientResources resources = new PatientResources();
        resources.setObservations(List.of(
            createLabObservation("13457-7", new BigDecimal("140"), LocalDate.now().minusDays(200)),
            createLabObservation("13457-7", new BigDecimal("96"), LocalDate.now().minusDays(10)),
            createLabObservation("13457-7", new BigDecimal("180"), LocalDate.now().minusDays(400))));

        Optional<Observation> result = resources.getLatestObservation("13457-7");
        assertTrue(result.isPresent());
        assertEquals(new BigDecimal("96"), result.get().getValueQuantity().getValue());
    }

    @Test
    public void testGetLatestObservation_AnyOfSeveralCodes() {
        PatientResources resources = new PatientResources();
        resources.setObservations(List.of(
            createLabObservation("13457-7", new BigDecimal("120"), LocalDate.now().minusDays(30)),
            createLabObservation("18262-5", new BigDecimal("110"), LocalDate.now().minusDays(3))));

        Optional<Observation> result = resources.getLatestObservation("13457-7", "18262-5", "2089-1");
        assertEquals(new BigDecimal("110"), result.orElseThrow().getValueQuantity().getValue());
    }

    @Test
    public void testGetLatestObservation_DifferentCode() {
        PatientResources resources = new PatientResources();
        resources.setObservations(List.of(
            createLabObservation("33914-3", new BigDecimal("45"), LocalDate.now().minusDays(3))));

        assertFalse(resources.getLatestObservation("13457-7").isPresent());
    }

    @Test
    public void testGetLatestObservation_NonLoincSystemIgnored() {
        Observation local = createLabObservation("13457-7", new BigDecimal("100"), LocalDate.now());
        local.getCode().getCodingFirstRep().setSystem("http://example.org/local-codes");

        PatientResources resources = new PatientResources();
        resources.setObservations(List.of(local));

        assertFalse(resources.getLatestObservation("13457-7").isPresent());
    }

    @Test
    public void testGetLatestObservation_ObservationWithoutDate() {
        Observation withoutDate = new Observation();
        withoutDate.setCode(new CodeableConcept().addCoding(new Coding("http://loinc.org", "13457-7", null)));
        withoutDate.setValue(new Quantity(200));

        PatientResources resources = new PatientResources();
        resources.setObservations(List.of(
            withoutDate,
            createLabObservation("13457-7", new BigDecimal("115"), LocalDate.now().minusDays(5))));

        Optional<Observation> result = resources.getLatestObservation("13457-7");
        assertEquals(new BigDecimal("115"), result.orElseThrow().getValueQuantity().getValue());
    }

    @Test
    public void testGetLatestObservation_EmptyObservations() {
        assertFalse(new PatientResources().getLatestObservation("13457-7").isPresent());
    }

    // ========== Concept Helper Tests ==========

    @Test
    public void testDescribe_TextAndDisplays() {
        CodeableConcept concept = new CodeableConcept()
            .setText("History of MI")
            .addCoding(new Coding("http://snomed.info/sct", "22298006", "Myocardial infarction"));

        assertEquals("History of MI Myocardial infarction", PatientResources.describe(concept));
    }

    @Test
    public void testDescribe_NullConcept() {
        assertEquals("", PatientResources.describe(null));
    }

    @Test
    public void testHasAnyCode() {
        CodeableConcept concept = new CodeableConcept()
            .addCoding(new Coding("http://snomed.info/sct", "38341003", "Hypertensive disorder"));

        assertTrue(PatientResources.hasAnyCode(concept, List.of("59621000", "38341003")));
        assertFalse(PatientResources.hasAnyCode(concept, List.of("44054006")));
        assertFalse(PatientResources.hasAnyCode(new CodeableConcept(), List.of("38341003")));
        assertFalse(PatientResources.hasAnyCode(null, List.of("38341003")));
    }

    // ========== Setter Tests ==========

    @Test
    public void testSetters_NullListsBecomeEmpty() {
        PatientResources resources = new PatientResources("p1", null, null, null, null, null);
        resources.setConditions(null);

        assertTrue(resources.getConditions().isEmpty());
        assertTrue(resources.getObservations().isEmpty());
        assertTrue(resources.getMedications().isEmpty());
        assertTrue(resources.getProcedures().isEmpty());
    }

    // ========== Helper Methods ==========

    private Patient createPatient(LocalDate birthDate) {
        Patient patient = new Patient();
        patient.setBirthDate(Date.from(birthDate.atStartOfDay(ZoneId.systemDefault()).toInstant()));
        return patient;
    }

    private Observation createLabObservation(String loincCode, BigDecimal value, LocalDate date) {
        Observation obs = new Observation();

        CodeableConcept code = new CodeableConcept();
        Coding coding = new Coding();
        coding.setSystem("http://loinc.org");
        coding.setCode(loincCode);
        code.addCoding(coding);
        obs.setCode(code);

        Quantity quantity = new Quantity();
        quantity.setValue(value);
        quantity.setUnit("mg/dL");
        obs.setValue(quantity);

        Date effectiveDate = Date.from(date.atStartOfDay(ZoneId.systemDefault()).toInstant());
        obs.setEffective(new DateTimeType(effectiveDate));

        return obs;
    }
}
