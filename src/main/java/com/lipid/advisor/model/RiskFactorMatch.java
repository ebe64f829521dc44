package com.lipid.advisor.model;

import java.util.Objects;

/**
 * One satisfied reimbursement risk-factor criterion
 */
public final class RiskFactorMatch {
    private final String id;
    private final String label;

    public RiskFactorMatch(String id, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = Objects.requireNonNull(label, "label");
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RiskFactorMatch other)) {
            return false;
        }
        return id.equals(other.id) && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }

    @Override
    public String toString() {
        return id + " (" + label + ")";
    }
}
