package com.lipid.advisor.evaluator;

import com.lipid.advisor.model.ClinicalFlag;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.PreventionCategory;

/**
 * Secondary prevention means a history of ACS or coronary revascularization (PCI or CABG)
 */
public class PreventionCategoryResolver {

    public PreventionCategory resolve(PatientState state) {
        if (state == null) {
            throw new IllegalArgumentException("PatientState cannot be null");
        }
        boolean secondary = state.has(ClinicalFlag.ACS_HISTORY)
                || state.has(ClinicalFlag.PCI_HISTORY)
                || state.has(ClinicalFlag.CABG_HISTORY);
        return secondary ? PreventionCategory.SECONDARY : PreventionCategory.PRIMARY;
    }
}
