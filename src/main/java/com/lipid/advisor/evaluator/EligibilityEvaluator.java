package com.lipid.advisor.evaluator;

import com.lipid.advisor.evidence.EvidenceIds;
import com.lipid.advisor.model.EligibilityResult;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.PreventionCategory;
import com.lipid.advisor.model.RiskFactorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates Taiwan NHI lipid-lowering drug reimbursement eligibility.
 * <ul>
 *   <li>Secondary prevention (ACS, PCI or CABG history): start at LDL-C ≥70, goal &lt;70 (rule 2.6.1)</li>
 *   <li>Primary prevention, ≥2 risk factors: start at LDL-C ≥130</li>
 *   <li>Primary prevention, 1 risk factor: start at LDL-C ≥160</li>
 *   <li>Primary prevention, 0 risk factors: intentionally not decided here</li>
 * </ul>
 */
public class EligibilityEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(EligibilityEvaluator.class);

    private static final int SECONDARY_THRESHOLD = 70;
    private static final int SECONDARY_GOAL = 70;
    private static final int PRIMARY_TWO_RF_THRESHOLD = 130;
    private static final int PRIMARY_ONE_RF_THRESHOLD = 160;

    static final String REMINDER_FOLLOW_UP =
        "Follow-up lipids: Year 1 every 3–6 months; Year ≥2 every 6–12 months.";
    static final String REMINDER_SAFETY =
        "Document safety monitoring: liver function abnormality and rhabdomyolysis.";
    static final String REMINDER_PARALLEL_LIFESTYLE =
        "Lifestyle modification may be done in parallel with drug therapy (no mandatory lifestyle-only trial first).";
    static final String REMINDER_DOCUMENTATION =
        "Ensure risk factors are explicitly documented (HTN/DM/smoking/age/FH) for auditability.";

    private final RiskFactorCounter riskFactorCounter;
    private final PreventionCategoryResolver preventionCategoryResolver;

    public EligibilityEvaluator() {
        this(new RiskFactorCounter(), new PreventionCategoryResolver());
    }

    public EligibilityEvaluator(RiskFactorCounter riskFactorCounter,
                                PreventionCategoryResolver preventionCategoryResolver) {
        this.riskFactorCounter = riskFactorCounter;
        this.preventionCategoryResolver = preventionCategoryResolver;
    }

    /**
     * Evaluate eligibility using the LDL-C value recorded on the patient state
     * @param state The patient state
     * @return EligibilityResult with verdict, rationale and reminders
     */
    public EligibilityResult evaluate(PatientState state) {
        if (state == null) {
            throw new IllegalArgumentException("PatientState cannot be null");
        }
        return evaluate(state, state.getLdlMgdl().orElse(null));
    }

    /**
     * Evaluate eligibility with an explicitly supplied LDL-C value
     * @param state The patient state providing risk factors and prevention history
     * @param rawLdl LDL-C as a number or as text containing a number; null when unknown
     * @return EligibilityResult with verdict, rationale and reminders
     */
    public EligibilityResult evaluate(PatientState state, Object rawLdl) {
        if (state == null) {
            throw new IllegalArgumentException("PatientState cannot be null");
        }

        List<RiskFactorMatch> riskFactors = riskFactorCounter.count(state);
        PreventionCategory category = preventionCategoryResolver.resolve(state);
        Optional<Double> ldl = LipidValueParser.parse(rawLdl);

        EligibilityResult result = new EligibilityResult(category, ldl.orElse(null), riskFactors);

        if (ldl.isEmpty()) {
            result.setEligible(false);
            result.addRationale("LDL value missing/invalid → cannot determine NHI eligibility.");
            logger.debug("Eligibility undetermined: no usable LDL-C value");
            return result;
        }

        double ldlValue = ldl.get();
        if (category == PreventionCategory.SECONDARY) {
            applySecondaryPrevention(result, ldlValue);
        } else {
            applyPrimaryPrevention(result, ldlValue, riskFactors.size());
        }
        result.addReminder(REMINDER_DOCUMENTATION);

        logger.debug("Eligibility evaluated: {}", result);
        return result;
    }

    private void applySecondaryPrevention(EligibilityResult result, double ldl) {
        result.setThresholdMgdl(SECONDARY_THRESHOLD);
        result.setGoalMgdl(SECONDARY_GOAL);
        result.setRuleEvidenceId(EvidenceIds.NHI_SECONDARY_PREVENTION);

        if (ldl >= SECONDARY_THRESHOLD) {
            result.setEligible(true);
            result.addRationale("Secondary prevention (ACS/PCI/CABG) + LDL ≥70 → eligible per NHI 2.6.1 logic.");
        } else {
            result.setEligible(false);
            result.addRationale("Secondary prevention present but LDL <70 → does not meet NHI start threshold (2.6.1).");
        }

        result.addReminder(REMINDER_FOLLOW_UP);
        result.addReminder(REMINDER_SAFETY);
        result.addReminder(REMINDER_PARALLEL_LIFESTYLE);
    }

    private void applyPrimaryPrevention(EligibilityResult result, double ldl, int riskFactorCount) {
        if (riskFactorCount >= 2) {
            result.setThresholdMgdl(PRIMARY_TWO_RF_THRESHOLD);
            result.setRuleEvidenceId(EvidenceIds.NHI_PRIMARY_RF_GTE2);
            if (ldl >= PRIMARY_TWO_RF_THRESHOLD) {
                result.setEligible(true);
                result.addRationale("Primary prevention + ≥2 risk factors + LDL ≥130 → eligible (operational NHI rule).");
            } else {
                result.setEligible(false);
                result.addRationale("Primary prevention + ≥2 risk factors but LDL <130 → not eligible by threshold.");
            }
        } else if (riskFactorCount == 1) {
            result.setThresholdMgdl(PRIMARY_ONE_RF_THRESHOLD);
            result.setRuleEvidenceId(EvidenceIds.NHI_PRIMARY_RF_EQ1);
            if (ldl >= PRIMARY_ONE_RF_THRESHOLD) {
                result.setEligible(true);
                result.addRationale("Primary prevention + 1 risk factor + LDL ≥160 → eligible (operational NHI rule).");
            } else {
                result.setEligible(false);
                result.addRationale("Primary prevention + 1 risk factor but LDL <160 → not eligible by threshold.");
            }
        } else {
            // Threshold deliberately left unknown at this tier
            result.setThresholdMgdl(null);
            result.setRuleEvidenceId(EvidenceIds.NHI_PRIMARY_RF_EQ0);
            result.setEligible(false);
            result.addRationale("Primary prevention + 0 risk factors → operational rule not defined here.");
        }
    }
}
