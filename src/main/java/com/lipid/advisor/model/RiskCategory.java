package com.lipid.advisor.model;

/**
 * Cardiovascular risk categories, highest first
 */
public enum RiskCategory {
    VERY_HIGH("very_high"),
    HIGH("high"),
    MODERATE("moderate"),
    LOW("low");

    private final String id;

    RiskCategory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
