package com.lipid.advisor.evidence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EvidenceTable
 */
public class EvidenceTableTest {

    private EvidenceTable table;

    @BeforeEach
    public void setUp() {
        table = EvidenceTable.loadDefault();
    }

    // ========== Bundled Table Tests ==========

    @Test
    public void testLoadDefault_Size() {
        assertEquals(43, table.size());
        assertEquals(43, table.all().size());
    }

    @Test
    public void testLoadDefault_ResolvesEveryEmittedId() {
        assertDoesNotThrow(() -> table.requireAll(EvidenceIds.all()));
        for (String id : EvidenceIds.all()) {
            assertTrue(table.contains(id), id);
        }
    }

    @Test
    public void testLoadDefault_CategoryCounts() {
        assertEquals(6, table.byCategory(EvidenceCategory.LDL_TARGET).size());
        assertEquals(6, table.byCategory(EvidenceCategory.TREATMENT_LOGIC).size());
        assertEquals(3, table.byCategory(EvidenceCategory.NON_STATIN_THERAPY).size());
        assertEquals(1, table.byCategory(EvidenceCategory.STATIN_INTOLERANCE).size());
        assertEquals(7, table.byCategory(EvidenceCategory.LIPOPROTEIN_A).size());
        assertEquals(16, table.byCategory(EvidenceCategory.NHI_REIMBURSEMENT).size());
        assertEquals(4, table.byCategory(EvidenceCategory.NHI_RISK_FACTOR).size());
    }

    @Test
    public void testFind_VeryHighRiskTarget() {
        EvidenceReference reference = table.find(EvidenceIds.ESC_LDL_VERY_HIGH_RISK).orElseThrow();

        assertEquals(EvidenceCategory.LDL_TARGET, reference.getCategory());
        assertEquals(2025, reference.getYear().orElseThrow());
        assertTrue(reference.getSummary().orElseThrow().contains("55 mg/dL"));
        assertTrue(reference.getQuote().isPresent());
    }

    @Test
    public void testFind_ReferenceWithoutQuote() {
        EvidenceReference reference = table.find(EvidenceIds.NHI_PRIMARY_RF_EQ0).orElseThrow();

        assertTrue(reference.getQuote().isEmpty());
        assertTrue(reference.getNote().isPresent());
    }

    @Test
    public void testFind_UnknownAndNullIds() {
        assertTrue(table.find("NOT_AN_ID").isEmpty());
        assertTrue(table.find(null).isEmpty());
        assertFalse(table.contains(null));
    }

    @Test
    public void testAll_Unmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> table.all().clear());
    }

    // ========== requireAll Tests ==========

    @Test
    public void testRequireAll_MissingIdsNamed() {
        EvidenceTable small = EvidenceTable.of(List.of(createReference("A")));

        EvidenceLoadException e = assertThrows(EvidenceLoadException.class,
            () -> small.requireAll(List.of("A", "B", "C")));

        assertTrue(e.getMessage().contains("[B, C]"));
    }

    // ========== Construction Tests ==========

    @Test
    public void testOf_DuplicateId() {
        List<EvidenceReference> references = List.of(createReference("A"), createReference("A"));

        assertThrows(EvidenceLoadException.class, () -> EvidenceTable.of(references));
    }

    @Test
    public void testOf_KeepsOrder() {
        EvidenceTable small = EvidenceTable.of(List.of(createReference("B"), createReference("A")));

        assertEquals(List.of("B", "A"), small.all().stream().map(EvidenceReference::getId).toList());
    }

    @Test
    public void testLoad_MissingResource() {
        assertThrows(EvidenceLoadException.class, () -> EvidenceTable.load("/evidence/missing.json"));
    }

    @Test
    public void testParse_MalformedJson() {
        InputStream in = stream("[{\"id\": \"A\", ");

        assertThrows(EvidenceLoadException.class, () -> EvidenceTable.parse(in));
    }

    @Test
    public void testParse_MissingRequiredField() {
        InputStream in = stream("[{\"id\": \"A\", \"guideline\": \"G\"}]");

        assertThrows(EvidenceLoadException.class, () -> EvidenceTable.parse(in));
    }

    @Test
    public void testParse_UnknownPropertiesIgnored() throws Exception {
        InputStream in = stream("[{\"id\": \"A\", \"category\": \"LDL_TARGET\", \"guideline\": \"G\", \"extra\": 1}]");

        EvidenceTable parsed = EvidenceTable.parse(in);

        assertEquals(1, parsed.size());
        assertTrue(parsed.find("A").orElseThrow().getYear().isEmpty());
    }

    // ========== Citation Tests ==========

    @Test
    public void testCitation_GuidelineYearSection() {
        EvidenceReference reference = new EvidenceReference("X", EvidenceCategory.LDL_TARGET,
            "ESC/EAS Guideline", 2025, "Table 3", null, null, null, null);

        assertEquals("ESC/EAS Guideline 2025, Table 3", reference.citation());
    }

    @Test
    public void testCitation_YearAlreadyInGuideline() {
        EvidenceReference reference = new EvidenceReference("X", EvidenceCategory.NHI_REIMBURSEMENT,
            "NHI 2024 amendment", 2024, null, null, null, null, null);

        assertEquals("NHI 2024 amendment", reference.citation());
    }

    // ========== Helper Methods ==========

    private EvidenceReference createReference(String id) {
        return new EvidenceReference(id, EvidenceCategory.LDL_TARGET, "Guideline", null,
            null, null, "summary", null, null);
    }

    private InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
