package com.lipid.advisor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientState construction and value semantics
 */
public class PatientStateTest {

    @Test
    public void testEmpty_AllUnknown() {
        PatientState state = PatientState.empty();

        assertTrue(state.getAge().isEmpty());
        assertEquals(Sex.UNKNOWN, state.getSex());
        assertTrue(state.getLdlMgdl().isEmpty());
        assertTrue(state.getFlags().isEmpty());
    }

    @Test
    public void testBuilder_NegativeAgeIsUnknown() {
        assertTrue(PatientState.builder().age(-3).build().getAge().isEmpty());
    }

    @Test
    public void testBuilder_NonFiniteLdlIsUnknown() {
        assertTrue(PatientState.builder().ldlMgdl(Double.NaN).build().getLdlMgdl().isEmpty());
        assertTrue(PatientState.builder().ldlMgdl(Double.NEGATIVE_INFINITY).build().getLdlMgdl().isEmpty());
    }

    @Test
    public void testBuilder_NullSexIsUnknown() {
        assertEquals(Sex.UNKNOWN, PatientState.builder().sex(null).build().getSex());
    }

    @Test
    public void testBuilder_FlagCanBeCleared() {
        PatientState state = PatientState.builder()
            .flag(ClinicalFlag.DIABETES)
            .flag(ClinicalFlag.DIABETES, false)
            .build();

        assertFalse(state.has(ClinicalFlag.DIABETES));
    }

    @Test
    public void testToBuilder_DerivesWithoutMutatingOriginal() {
        PatientState original = PatientState.builder()
            .age(60)
            .sex(Sex.F)
            .ldlMgdl(120.0)
            .flag(ClinicalFlag.HYPERTENSION)
            .build();

        PatientState derived = original.toBuilder().flag(ClinicalFlag.CURRENT_SMOKER).ldlMgdl(95.0).build();

        assertEquals(120.0, original.getLdlMgdl().orElseThrow());
        assertFalse(original.has(ClinicalFlag.CURRENT_SMOKER));
        assertEquals(60, derived.getAge().orElseThrow());
        assertEquals(Sex.F, derived.getSex());
        assertTrue(derived.has(ClinicalFlag.HYPERTENSION));
        assertTrue(derived.has(ClinicalFlag.CURRENT_SMOKER));
    }

    @Test
    public void testGetFlags_Unmodifiable() {
        PatientState state = PatientState.builder().flag(ClinicalFlag.ACS_HISTORY).build();

        assertThrows(UnsupportedOperationException.class, () -> state.getFlags().add(ClinicalFlag.DIABETES));
    }

    @Test
    public void testEquals_SameContent() {
        PatientState first = PatientState.builder().age(47).sex(Sex.M).flag(ClinicalFlag.HYPERTENSION).build();
        PatientState second = PatientState.builder().flag(ClinicalFlag.HYPERTENSION).sex(Sex.M).age(47).build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, first.toBuilder().age(48).build());
    }
}
