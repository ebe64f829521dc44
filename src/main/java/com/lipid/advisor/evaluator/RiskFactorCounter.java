package com.lipid.advisor.evaluator;

import com.lipid.advisor.model.ClinicalFlag;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.RiskFactorMatch;
import com.lipid.advisor.model.Sex;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts Taiwan NHI cardiovascular risk factors for primary-prevention reimbursement.
 * Each criterion is evaluated exactly once, in a fixed order.
 */
public class RiskFactorCounter {

    public static final String RF_AGE_MALE = "NHI_RF_AGE_MALE";
    public static final String RF_AGE_FEMALE = "NHI_RF_AGE_FEMALE";
    public static final String RF_HYPERTENSION = "NHI_RF_HYPERTENSION";
    public static final String RF_DIABETES = "NHI_RF_DIABETES";
    public static final String RF_SMOKING = "NHI_RF_SMOKING";
    public static final String RF_FAMILY_HISTORY = "NHI_RF_FAMILY_HISTORY";

    private static final int MALE_AGE_THRESHOLD = 45;
    private static final int FEMALE_AGE_THRESHOLD = 55;

    /**
     * @param state The patient state
     * @return Matched risk factors in evaluation order; the list size is the count (0 to 6)
     */
    public List<RiskFactorMatch> count(PatientState state) {
        if (state == null) {
            throw new IllegalArgumentException("PatientState cannot be null");
        }

        List<RiskFactorMatch> matched = new ArrayList<>();
        int age = state.getAge().orElse(-1);

        if (state.getSex() == Sex.M && age >= MALE_AGE_THRESHOLD) {
            matched.add(new RiskFactorMatch(RF_AGE_MALE, "Age male ≥45"));
        }
        if (state.getSex() == Sex.F && age >= FEMALE_AGE_THRESHOLD) {
            matched.add(new RiskFactorMatch(RF_AGE_FEMALE, "Age female ≥55"));
        }
        if (state.has(ClinicalFlag.HYPERTENSION) || state.has(ClinicalFlag.ANTIHYPERTENSIVE_MEDICATION)) {
            matched.add(new RiskFactorMatch(RF_HYPERTENSION, "Hypertension"));
        }
        if (state.has(ClinicalFlag.DIABETES)) {
            matched.add(new RiskFactorMatch(RF_DIABETES, "Diabetes"));
        }
        if (state.has(ClinicalFlag.CURRENT_SMOKER)) {
            matched.add(new RiskFactorMatch(RF_SMOKING, "Current smoking"));
        }
        if (state.has(ClinicalFlag.FAMILY_HISTORY_PREMATURE_ASCVD)) {
            matched.add(new RiskFactorMatch(RF_FAMILY_HISTORY, "FH premature ASCVD"));
        }

        return List.copyOf(matched);
    }
}
