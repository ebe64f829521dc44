package com.lipid.advisor.model;

import java.util.Objects;

/**
 * Everything the decision engine derived for one input: the structured state, the risk
 * profile it classified, and both verdicts
 */
public final class AnnotationResult {
    private final String sourceId;
    private final ExtractionResult extraction;
    private final RiskProfile riskProfile;
    private final RiskAssessment riskAssessment;
    private final EligibilityResult eligibility;
    private final boolean lipidTopic;

    public AnnotationResult(String sourceId, ExtractionResult extraction, RiskProfile riskProfile,
                            RiskAssessment riskAssessment, EligibilityResult eligibility, boolean lipidTopic) {
        this.sourceId = sourceId;
        this.extraction = Objects.requireNonNull(extraction, "extraction");
        this.riskProfile = Objects.requireNonNull(riskProfile, "riskProfile");
        this.riskAssessment = Objects.requireNonNull(riskAssessment, "riskAssessment");
        this.eligibility = Objects.requireNonNull(eligibility, "eligibility");
        this.lipidTopic = lipidTopic;
    }

    /**
     * @return File name, patient id or other label identifying the input; may be null
     */
    public String getSourceId() {
        return sourceId;
    }

    public PatientState getState() {
        return extraction.getState();
    }

    public ExtractionResult getExtraction() {
        return extraction;
    }

    public RiskProfile getRiskProfile() {
        return riskProfile;
    }

    public RiskAssessment getRiskAssessment() {
        return riskAssessment;
    }

    public EligibilityResult getEligibility() {
        return eligibility;
    }

    /**
     * @return true when the input discusses lipids, so guideline evidence is worth citing
     */
    public boolean isLipidTopic() {
        return lipidTopic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnnotationResult other)) {
            return false;
        }
        return lipidTopic == other.lipidTopic
                && Objects.equals(sourceId, other.sourceId)
                && extraction.equals(other.extraction)
                && riskProfile.equals(other.riskProfile)
                && riskAssessment.equals(other.riskAssessment)
                && eligibility.equals(other.eligibility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, extraction, riskProfile, riskAssessment, eligibility, lipidTopic);
    }
}
