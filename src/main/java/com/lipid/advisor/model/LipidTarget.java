package com.lipid.advisor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * LDL-C treatment goal attached to a risk category
 */
public final class LipidTarget {
    private static final LipidTarget NONE = new LipidTarget(null, null, null);

    private final Integer ldlMgdl;
    private final Integer percentReduction;
    private final String evidenceId;

    public LipidTarget(Integer ldlMgdl, Integer percentReduction, String evidenceId) {
        this.ldlMgdl = ldlMgdl;
        this.percentReduction = percentReduction;
        this.evidenceId = evidenceId;
    }

    /**
     * @return A target with no forced threshold, reduction or citation
     */
    public static LipidTarget none() {
        return NONE;
    }

    public Optional<Integer> getLdlMgdl() {
        return Optional.ofNullable(ldlMgdl);
    }

    public Optional<Integer> getPercentReduction() {
        return Optional.ofNullable(percentReduction);
    }

    public Optional<String> getEvidenceId() {
        return Optional.ofNullable(evidenceId);
    }

    public boolean isDefined() {
        return ldlMgdl != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LipidTarget other)) {
            return false;
        }
        return Objects.equals(ldlMgdl, other.ldlMgdl)
                && Objects.equals(percentReduction, other.percentReduction)
                && Objects.equals(evidenceId, other.evidenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ldlMgdl, percentReduction, evidenceId);
    }

    @Override
    public String toString() {
        if (!isDefined()) {
            return "no forced LDL-C target";
        }
        return "LDL-C <" + ldlMgdl + " mg/dL, >=" + percentReduction + "% reduction (" + evidenceId + ")";
    }
}
