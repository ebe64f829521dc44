package com.lipid.advisor.evidence;

public enum EvidenceCategory {
    LDL_TARGET,
    TREATMENT_LOGIC,
    NON_STATIN_THERAPY,
    STATIN_INTOLERANCE,
    LIPOPROTEIN_A,
    NHI_REIMBURSEMENT,
    NHI_RISK_FACTOR
}
