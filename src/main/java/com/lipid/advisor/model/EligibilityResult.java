package com.lipid.advisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a lipid-lowering drug reimbursement check
 */
public class EligibilityResult {
    private final PreventionCategory preventionCategory;
    private final Double ldlMgdl;
    private final List<RiskFactorMatch> matchedRiskFactors;
    private boolean eligible;
    private Integer thresholdMgdl;
    private Integer goalMgdl;
    private String ruleEvidenceId;
    private final List<String> rationale;
    private final List<String> reminders;

    public EligibilityResult(PreventionCategory preventionCategory, Double ldlMgdl,
                             List<RiskFactorMatch> matchedRiskFactors) {
        this.preventionCategory = preventionCategory;
        this.ldlMgdl = ldlMgdl;
        this.matchedRiskFactors = matchedRiskFactors != null ? List.copyOf(matchedRiskFactors) : List.of();
        this.rationale = new ArrayList<>();
        this.reminders = new ArrayList<>();
    }

    /**
     * Append a rationale sentence describing which rule fired and why
     * @param sentence The rationale sentence
     */
    public void addRationale(String sentence) {
        this.rationale.add(sentence);
    }

    /**
     * Append a follow-up reminder
     * @param reminder The reminder text
     */
    public void addReminder(String reminder) {
        this.reminders.add(reminder);
    }

    // Getters and setters
    public PreventionCategory getPreventionCategory() {
        return preventionCategory;
    }

    public Optional<Double> getLdlMgdl() {
        return Optional.ofNullable(ldlMgdl);
    }

    public int getRiskFactorCount() {
        return matchedRiskFactors.size();
    }

    public List<RiskFactorMatch> getMatchedRiskFactors() {
        return matchedRiskFactors;
    }

    public boolean isEligible() {
        return eligible;
    }

    public void setEligible(boolean eligible) {
        this.eligible = eligible;
    }

    public Optional<Integer> getThresholdMgdl() {
        return Optional.ofNullable(thresholdMgdl);
    }

    public void setThresholdMgdl(Integer thresholdMgdl) {
        this.thresholdMgdl = thresholdMgdl;
    }

    /**
     * @return The treatment goal; the patient should reach an LDL-C strictly below it
     */
    public Optional<Integer> getGoalMgdl() {
        return Optional.ofNullable(goalMgdl);
    }

    public void setGoalMgdl(Integer goalMgdl) {
        this.goalMgdl = goalMgdl;
    }

    /**
     * @return Evidence id of the reimbursement rule that was applied
     */
    public Optional<String> getRuleEvidenceId() {
        return Optional.ofNullable(ruleEvidenceId);
    }

    public void setRuleEvidenceId(String ruleEvidenceId) {
        this.ruleEvidenceId = ruleEvidenceId;
    }

    public List<String> getRationale() {
        return Collections.unmodifiableList(rationale);
    }

    public List<String> getReminders() {
        return Collections.unmodifiableList(reminders);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EligibilityResult other)) {
            return false;
        }
        return eligible == other.eligible
                && preventionCategory == other.preventionCategory
                && Objects.equals(ldlMgdl, other.ldlMgdl)
                && matchedRiskFactors.equals(other.matchedRiskFactors)
                && Objects.equals(thresholdMgdl, other.thresholdMgdl)
                && Objects.equals(goalMgdl, other.goalMgdl)
                && Objects.equals(ruleEvidenceId, other.ruleEvidenceId)
                && rationale.equals(other.rationale)
                && reminders.equals(other.reminders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(preventionCategory, ldlMgdl, matchedRiskFactors, eligible,
                thresholdMgdl, goalMgdl, ruleEvidenceId, rationale, reminders);
    }

    @Override
    public String toString() {
        return "EligibilityResult{category=" + preventionCategory.getId()
                + ", ldl=" + ldlMgdl
                + ", riskFactors=" + getRiskFactorCount()
                + ", eligible=" + eligible
                + ", threshold=" + thresholdMgdl
                + ", goal=" + goalMgdl + "}";
    }
}
