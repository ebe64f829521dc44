package com.lipid.advisor.model;

import java.util.List;
import java.util.Objects;

public final class RiskAssessment {
    private final RiskCategory category;
    private final List<String> reasons;
    private final LipidTarget lipidTarget;

    public RiskAssessment(RiskCategory category, List<String> reasons, LipidTarget lipidTarget) {
        this.category = Objects.requireNonNull(category, "category");
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
        this.lipidTarget = lipidTarget != null ? lipidTarget : LipidTarget.none();
    }

    public RiskCategory getCategory() {
        return category;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public LipidTarget getLipidTarget() {
        return lipidTarget;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RiskAssessment other)) {
            return false;
        }
        return category == other.category
                && reasons.equals(other.reasons)
                && lipidTarget.equals(other.lipidTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, reasons, lipidTarget);
    }

    @Override
    public String toString() {
        return "RiskAssessment{category=" + category.getId() + ", reasons=" + reasons + ", target=" + lipidTarget + "}";
    }
}
