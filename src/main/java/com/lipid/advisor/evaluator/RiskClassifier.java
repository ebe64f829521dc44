package com.lipid.advisor.evaluator;

import com.lipid.advisor.evidence.EvidenceIds;
import com.lipid.advisor.model.LipidTarget;
import com.lipid.advisor.model.RiskAssessment;
import com.lipid.advisor.model.RiskCategory;
import com.lipid.advisor.model.RiskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stratifies cardiovascular risk along the ESC/EAS category ladder.
 * <p>
 * Rules are evaluated in order and the first match fixes the category, so a later
 * (lower) rule can never downgrade a category chosen by an earlier one. A single
 * non-specific risk factor such as isolated hypertension only ever yields moderate risk.
 * Lipoprotein(a) is not consulted.
 */
public class RiskClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RiskClassifier.class);

    // eGFR bands, mL/min/1.73 m²
    private static final double EGFR_SEVERE_CKD = 30;
    private static final double EGFR_MODERATE_CKD_UPPER = 59;

    // Markedly elevated single risk factors
    private static final double MARKED_SBP_MMHG = 180;
    private static final double MARKED_LDL_MGDL = 190;

    private static final int DM_VERY_HIGH_RISK_FACTOR_COUNT = 3;

    private static final int VERY_HIGH_LDL_TARGET = 55;
    private static final int HIGH_LDL_TARGET = 70;
    private static final int TARGET_PERCENT_REDUCTION = 50;

    private final List<RiskRule> ladder;

    public RiskClassifier() {
        this(defaultLadder());
    }

    /**
     * @param ladder Rules in priority order; the last rule must match every profile
     */
    public RiskClassifier(List<RiskRule> ladder) {
        if (ladder == null || ladder.isEmpty()) {
            throw new IllegalArgumentException("Risk ladder cannot be empty");
        }
        this.ladder = List.copyOf(ladder);
    }

    /**
     * Classify a patient's cardiovascular risk
     * @param profile The clinical profile
     * @return The assessment produced by the first matching rule
     */
    public RiskAssessment classify(RiskProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("RiskProfile cannot be null");
        }

        for (RiskRule rule : ladder) {
            if (rule.matches(profile)) {
                RiskAssessment assessment = rule.apply(profile);
                logger.debug("Risk rule '{}' fired: {}", rule.getName(), assessment.getCategory().getId());
                return assessment;
            }
        }

        throw new IllegalStateException("No risk rule matched; the ladder must end with a catch-all rule");
    }

    public List<RiskRule> getLadder() {
        return ladder;
    }

    /**
     * The ESC/EAS ladder, highest priority first
     * @return Ordered rules
     */
    public static List<RiskRule> defaultLadder() {
        List<RiskRule> rules = new ArrayList<>();

        // Very-high risk
        rules.add(new RiskRule("established-ascvd",
            RiskProfile::isAscvd,
            p -> veryHigh(EvidenceIds.ESC_LDL_VERY_HIGH_RISK, "Established ASCVD → very-high risk.")));

        rules.add(new RiskRule("severe-ckd",
            p -> p.getEgfr().map(egfr -> egfr < EGFR_SEVERE_CKD).orElse(false),
            p -> veryHigh(EvidenceIds.ESC_LDL_CKD_SEVERE, "Severe CKD (eGFR <30) → very-high risk.")));

        rules.add(new RiskRule("diabetes-very-high",
            p -> p.isDiabetes() && (p.isDiabetesTargetOrganDamage()
                || p.getMajorRiskFactorCount().map(n -> n >= DM_VERY_HIGH_RISK_FACTOR_COUNT).orElse(false)
                || p.isLongDurationType1Diabetes()),
            p -> veryHigh(EvidenceIds.ESC_LDL_DM_VERY_HIGH,
                "Diabetes with target organ damage or ≥3 major RF or long-duration T1DM → very-high risk.")));

        rules.add(new RiskRule("score2-very-high",
            p -> p.getScore2Category().orElse(null) == RiskCategory.VERY_HIGH,
            p -> veryHigh(EvidenceIds.ESC_LDL_VERY_HIGH_RISK, "Caller-provided SCORE2 category = very_high.")));

        // High risk
        rules.add(new RiskRule("moderate-ckd",
            p -> p.getEgfr().map(egfr -> egfr >= EGFR_SEVERE_CKD && egfr <= EGFR_MODERATE_CKD_UPPER).orElse(false),
            p -> high(EvidenceIds.ESC_LDL_CKD_MODERATE, List.of("Moderate CKD (eGFR 30–59) → high risk."))));

        rules.add(new RiskRule("markedly-elevated-single-factor",
            p -> hasMarkedlyHighSbp(p) || hasMarkedlyHighLdl(p),
            p -> {
                List<String> reasons = new ArrayList<>();
                if (hasMarkedlyHighSbp(p)) {
                    reasons.add("Markedly elevated SBP (≥180 mmHg) → high risk.");
                }
                if (hasMarkedlyHighLdl(p)) {
                    reasons.add("Markedly elevated LDL-C (≥190 mg/dL) → high risk.");
                }
                return high(EvidenceIds.ESC_LDL_HIGH_RISK, reasons);
            }));

        // Engineering default: no verbatim guideline sentence backs this rung yet
        rules.add(new RiskRule("diabetes-default-high",
            RiskProfile::isDiabetes,
            p -> high(EvidenceIds.ESC_LDL_DM_HIGH, List.of(
                "Diabetes without very-high features → high risk (engineering default, not a verbatim guideline rule; "
                    + "pending guideline-exact evidence text)."))));

        rules.add(new RiskRule("score2-high",
            p -> p.getScore2Category().orElse(null) == RiskCategory.HIGH,
            p -> high(EvidenceIds.ESC_LDL_HIGH_RISK, List.of("Caller-provided SCORE2 category = high."))));

        // Moderate / low: no forced numeric LDL-C target
        rules.add(new RiskRule("risk-enhancer-moderate",
            p -> p.hasRiskEnhancer() || p.isFamilialHypercholesterolemia(),
            p -> {
                List<String> reasons = new ArrayList<>();
                if (p.isFamilialHypercholesterolemia()) {
                    reasons.add("Possible familial hypercholesterolemia noted (needs confirmation).");
                }
                reasons.add("No very-high/high ESC features detected → treat as moderate risk by default; "
                    + "consider lifetime risk & shared decision.");
                return new RiskAssessment(RiskCategory.MODERATE, reasons, LipidTarget.none());
            }));

        rules.add(new RiskRule("default-low",
            p -> true,
            p -> new RiskAssessment(RiskCategory.LOW,
                List.of("No major ESC very-high/high features detected → low risk by default."),
                LipidTarget.none())));

        return rules;
    }

    private static boolean hasMarkedlyHighSbp(RiskProfile profile) {
        return profile.getSystolicBp().map(sbp -> sbp >= MARKED_SBP_MMHG).orElse(false);
    }

    private static boolean hasMarkedlyHighLdl(RiskProfile profile) {
        return profile.getLdlMgdl().map(ldl -> ldl >= MARKED_LDL_MGDL).orElse(false);
    }

    private static RiskAssessment veryHigh(String evidenceId, String reason) {
        return new RiskAssessment(RiskCategory.VERY_HIGH, List.of(reason),
            new LipidTarget(VERY_HIGH_LDL_TARGET, TARGET_PERCENT_REDUCTION, evidenceId));
    }

    private static RiskAssessment high(String evidenceId, List<String> reasons) {
        return new RiskAssessment(RiskCategory.HIGH, reasons,
            new LipidTarget(HIGH_LDL_TARGET, TARGET_PERCENT_REDUCTION, evidenceId));
    }
}
