package com.lipid.advisor.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lipid.advisor.evaluator.ClinicalDecisionEngine;
import com.lipid.advisor.evidence.EvidenceIds;
import com.lipid.advisor.evidence.EvidenceTable;
import com.lipid.advisor.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReportGenerator
 */
public class ReportGeneratorTest {

    private ReportGenerator reportGenerator;
    private ClinicalDecisionEngine engine;

    @BeforeEach
    public void setUp() {
        reportGenerator = new ReportGenerator(EvidenceTable.loadDefault());
        engine = new ClinicalDecisionEngine();
    }

    // ========== formatAnnotation Tests ==========

    @Test
    public void testFormatAnnotation_VeryHighRiskEligible() {
        String section = reportGenerator.formatAnnotation(createVeryHighRiskResult("Patient/1", null));

        assertTrue(section.contains("Source: Patient/1"));
        assertTrue(section.contains("Patient: age 54, sex M, LDL-C 85 mg/dL"));
        assertTrue(section.contains("Findings: " + ClinicalFlag.ACS_HISTORY.getLabel()));
        assertTrue(section.contains("Cardiovascular Risk: VERY HIGH"));
        assertTrue(section.contains("  - Established ASCVD → very-high risk."));
        assertTrue(section.contains("LDL-C target: <55 mg/dL and ≥50% reduction from baseline"));
        assertTrue(section.contains("NHI Reimbursement: ELIGIBLE (secondary_prevention, start at LDL-C ≥70, goal <70)"));
        assertTrue(section.contains("Risk factors (1): Age male ≥45"));
        assertTrue(section.contains("  ✓ Secondary prevention"));
        assertTrue(section.contains("Reminders:"));
    }

    @Test
    public void testFormatAnnotation_EvidenceForLipidTopic() {
        String section = reportGenerator.formatAnnotation(createVeryHighRiskResult("Patient/1", null));

        assertTrue(section.contains("Evidence:"));
        assertTrue(section.contains("[" + EvidenceIds.ESC_LDL_VERY_HIGH_RISK + "]"));
        assertTrue(section.contains("[" + EvidenceIds.NHI_SECONDARY_PREVENTION + "]"));
        assertFalse(section.contains("not in evidence table"));
    }

    @Test
    public void testFormatAnnotation_NoEvidenceWithoutLipidTopic() {
        AnnotationResult result = engine.annotate("note-1", "58 y/o F, DM, HTN, follow-up visit");

        String section = reportGenerator.formatAnnotation(result);

        assertFalse(result.isLipidTopic());
        assertFalse(section.contains("Evidence:"));
        assertTrue(section.contains("Cardiovascular Risk: HIGH"));
        assertTrue(section.contains("Patient: age 58, sex F, LDL-C unknown"));
        assertTrue(section.contains("LDL value missing/invalid"));
    }

    @Test
    public void testFormatAnnotation_NoTargetMandated() {
        AnnotationResult result = engine.annotate("note-2", "Cough, no history. Cholesterol check requested");

        String section = reportGenerator.formatAnnotation(result);

        assertTrue(section.contains("Cardiovascular Risk: LOW"));
        assertTrue(section.contains("LDL-C target: none mandated; individualise"));
        assertTrue(section.contains("Patient: age unknown, sex unknown, LDL-C unknown"));
        assertFalse(section.contains("Findings:"));
    }

    @Test
    public void testFormatAnnotation_LipoproteinANote() {
        String section = reportGenerator.formatAnnotation(createVeryHighRiskResult("Patient/2", 120.0));

        assertTrue(section.contains("Note: Lp(a) 120 mg/dL (>50) is a risk-enhancing factor; category unchanged."));
        assertTrue(section.contains("[" + EvidenceIds.ESC_LPA_RISK_ENHANCER + "]"));
    }

    @Test
    public void testFormatAnnotation_LipoproteinAAtThresholdNotNoted() {
        String section = reportGenerator.formatAnnotation(createVeryHighRiskResult("Patient/3", 50.0));

        assertFalse(section.contains("Lp(a)"));
    }

    @Test
    public void testFormatAnnotation_UnknownEvidenceId() {
        ReportGenerator emptyTable = new ReportGenerator(EvidenceTable.of(List.of()));

        String section = emptyTable.formatAnnotation(createVeryHighRiskResult("Patient/4", null));

        assertTrue(section.contains("[" + EvidenceIds.ESC_LDL_VERY_HIGH_RISK + "] (not in evidence table)"));
    }

    // ========== generateReport Tests ==========

    @Test
    public void testGenerateReport_ContainsHeaderAndSeparators() {
        String report = reportGenerator.generateReport(List.of(createVeryHighRiskResult("Patient/1", null)));

        assertTrue(report.contains("LIPID MANAGEMENT DECISION SUPPORT REPORT"));
        assertTrue(report.contains("Date: "));
        assertTrue(report.contains("================================================================================"));
        assertTrue(report.contains("--------------------------------------------------------------------------------"));
        assertTrue(report.contains("SUMMARY"));
    }

    @Test
    public void testGenerateSummary_MultiplePatients() {
        List<AnnotationResult> results = new ArrayList<>();
        results.add(createVeryHighRiskResult("Patient/1", null));
        results.add(engine.annotate("note-1", "58 y/o F, DM, HTN, follow-up visit"));
        results.add(engine.annotate("note-2", "40M, HTN. LDL-C: 150 mg/dL"));

        String report = reportGenerator.generateReport(results);

        assertTrue(report.contains("Total Patients Assessed: 3"));
        assertTrue(report.contains("  - VERY HIGH risk: 1"));
        assertTrue(report.contains("  - HIGH risk: 1"));
        assertTrue(report.contains("  - MODERATE risk: 1"));
        assertTrue(report.contains("  - LOW risk: 0"));
        assertTrue(report.contains("NHI Reimbursement Eligible: 1"));
        assertTrue(report.contains("LDL-C Missing (eligibility undetermined): 1"));
    }

    @Test
    public void testGenerateSummary_NoMissingLdlLine() {
        String report = reportGenerator.generateReport(List.of(createVeryHighRiskResult("Patient/1", null)));

        assertFalse(report.contains("LDL-C Missing"));
    }

    @Test
    public void testGenerateReport_EmptyList() {
        assertEquals("No patients assessed.", reportGenerator.generateReport(new ArrayList<>()));
    }

    @Test
    public void testGenerateReport_NullList() {
        assertEquals("No patients assessed.", reportGenerator.generateReport(null));
    }

    // ========== Structured Report Tests ==========

    @Test
    public void testGenerateStructuredReport_SinglePatient() throws Exception {
        String report = reportGenerator.generateStructuredReport(List.of(createVeryHighRiskResult("Patient/1", 120.0)));

        JsonNode root = new ObjectMapper().readTree(report);
        JsonNode patient = root.get("patients").get(0);

        assertEquals("Patient/1", patient.get("source").asText());
        assertEquals(54, patient.get("patient").get("age").asInt());
        assertEquals("ACS_HISTORY", patient.get("patient").get("flags").get(0).asText());
        assertEquals("very_high", patient.get("risk").get("category").asText());
        assertEquals(55, patient.get("risk").get("ldlTargetMgdl").asInt());
        assertTrue(patient.get("risk").get("lipoproteinARiskEnhancer").asBoolean());
        assertTrue(patient.get("eligibility").get("eligible").asBoolean());
        assertEquals(70, patient.get("eligibility").get("thresholdMgdl").asInt());
        assertEquals(3, patient.get("evidence").size());
        assertEquals(1, root.get("summary").get("total").asInt());
        assertEquals(1, root.get("summary").get("riskCategories").get("very_high").asInt());
    }

    @Test
    public void testGenerateStructuredReport_UnknownValuesAreNull() throws Exception {
        AnnotationResult result = engine.annotate("note-1", "58 y/o F, DM, HTN, follow-up visit");

        JsonNode root = new ObjectMapper().readTree(reportGenerator.generateStructuredReport(List.of(result)));
        JsonNode eligibility = root.get("patients").get(0).get("eligibility");

        assertTrue(eligibility.get("ldlMgdl").isNull());
        assertTrue(eligibility.get("thresholdMgdl").isNull());
        assertEquals(0, root.get("patients").get(0).get("evidence").size());
        assertEquals(1, root.get("summary").get("ldlMissing").asInt());
    }

    @Test
    public void testGenerateStructuredReport_EmptyList() {
        assertEquals("{}", reportGenerator.generateStructuredReport(new ArrayList<>()));
        assertEquals("{}", reportGenerator.generateStructuredReport(null));
    }

    @Test
    public void testConstructor_NullEvidenceTable() {
        assertThrows(IllegalArgumentException.class, () -> new ReportGenerator(null));
    }

    // ========== Helper Methods ==========

    private AnnotationResult createVeryHighRiskResult(String sourceId, Double lipoproteinA) {
        PatientState state = PatientState.builder()
            .age(54)
            .sex(Sex.M)
            .ldlMgdl(85.0)
            .flag(ClinicalFlag.ACS_HISTORY)
            .build();
        RiskProfile profile = RiskProfile.from(state).lipoproteinA(lipoproteinA).build();
        return engine.assess(sourceId, state, profile);
    }
}
