package com.lipid.advisor.model;

public enum Sex {
    M,
    F,
    UNKNOWN;

    /**
     * Parse a sex code ("M", "F", "male", "female", ...)
     * @param code The code to parse, may be null
     * @return The matching Sex, or UNKNOWN
     */
    public static Sex fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code.trim().toLowerCase()) {
            case "m", "male", "man" -> M;
            case "f", "female", "woman" -> F;
            default -> UNKNOWN;
        };
    }
}
