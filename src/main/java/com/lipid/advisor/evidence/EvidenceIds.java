package com.lipid.advisor.evidence;

import java.util.List;

/**
 * Evidence ids referenced by the decision logic. Each must exist in the evidence table.
 */
public final class EvidenceIds {

    // ESC/EAS LDL-C targets
    public static final String ESC_LDL_VERY_HIGH_RISK = "ESC2025_LDL_VERY_HIGH_RISK";
    public static final String ESC_LDL_HIGH_RISK = "ESC2025_LDL_HIGH_RISK";
    public static final String ESC_LDL_DM_VERY_HIGH = "ESC2025_LDL_DM_VERY_HIGH";
    public static final String ESC_LDL_DM_HIGH = "ESC2025_LDL_DM_HIGH";
    public static final String ESC_LDL_CKD_SEVERE = "ESC2025_LDL_CKD_SEVERE";
    public static final String ESC_LDL_CKD_MODERATE = "ESC2025_LDL_CKD_MODERATE";

    // Lp(a)
    public static final String ESC_LPA_RISK_ENHANCER = "ESC2025_LPA_RISK_ENHANCER";

    // Taiwan NHI reimbursement tiers
    public static final String NHI_SECONDARY_PREVENTION = "NHI_LDL_SEC_PREV_ACS_OR_CAD_1080201";
    public static final String NHI_PRIMARY_RF_GTE2 = "NHI_LDL_PRIMARY_PREV_RF_GTE2";
    public static final String NHI_PRIMARY_RF_EQ1 = "NHI_LDL_PRIMARY_PREV_RF_EQ1";
    public static final String NHI_PRIMARY_RF_EQ0 = "NHI_LDL_PRIMARY_PREV_RF_EQ0";

    /**
     * @return Every id above, in declaration order
     */
    public static List<String> all() {
        return List.of(ESC_LDL_VERY_HIGH_RISK, ESC_LDL_HIGH_RISK, ESC_LDL_DM_VERY_HIGH, ESC_LDL_DM_HIGH,
                ESC_LDL_CKD_SEVERE, ESC_LDL_CKD_MODERATE, ESC_LPA_RISK_ENHANCER, NHI_SECONDARY_PREVENTION,
                NHI_PRIMARY_RF_GTE2, NHI_PRIMARY_RF_EQ1, NHI_PRIMARY_RF_EQ0);
    }

    private EvidenceIds() {
    }
}
