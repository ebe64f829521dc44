package com.lipid.advisor.model;

/**
 * Boolean clinical attributes recoverable from a narrative or coded record
 */
public enum ClinicalFlag {
    ACS_HISTORY("History of acute coronary syndrome"),
    PCI_HISTORY("Prior percutaneous coronary intervention"),
    CABG_HISTORY("Prior coronary artery bypass surgery"),
    HYPERTENSION("Hypertension"),
    ANTIHYPERTENSIVE_MEDICATION("Anti-hypertensive medication"),
    DIABETES("Diabetes"),
    CURRENT_SMOKER("Current smoking"),
    FAMILY_HISTORY_PREMATURE_ASCVD("Family history of premature ASCVD");

    private final String label;

    ClinicalFlag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
