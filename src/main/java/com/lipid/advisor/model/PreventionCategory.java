package com.lipid.advisor.model;

public enum PreventionCategory {
    PRIMARY("primary_prevention"),
    SECONDARY("secondary_prevention");

    private final String id;

    PreventionCategory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
