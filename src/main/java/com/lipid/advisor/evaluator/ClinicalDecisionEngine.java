package com.lipid.advisor.evaluator;

import com.lipid.advisor.extractor.AttributeExtractor;
import com.lipid.advisor.extractor.LipidTopicDetector;
import com.lipid.advisor.model.AnnotationResult;
import com.lipid.advisor.model.EligibilityResult;
import com.lipid.advisor.model.ExtractionResult;
import com.lipid.advisor.model.ExtractionTrace;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.RiskAssessment;
import com.lipid.advisor.model.RiskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full annotation pipeline: narrative → patient state → risk category and
 * NHI reimbursement verdict. Holds no per-call state, so one instance may serve many threads.
 */
public class ClinicalDecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalDecisionEngine.class);

    private final AttributeExtractor extractor;
    private final RiskClassifier riskClassifier;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final LipidTopicDetector topicDetector;

    public ClinicalDecisionEngine() {
        this(new AttributeExtractor(), new RiskClassifier(), new EligibilityEvaluator(), new LipidTopicDetector());
    }

    public ClinicalDecisionEngine(AttributeExtractor extractor, RiskClassifier riskClassifier,
                                  EligibilityEvaluator eligibilityEvaluator, LipidTopicDetector topicDetector) {
        this.extractor = extractor;
        this.riskClassifier = riskClassifier;
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.topicDetector = topicDetector;
    }

    /**
     * Annotate a free-text clinical narrative
     * @param sourceId Label for the input (file name, note id); may be null
     * @param narrative Raw narrative text
     * @return AnnotationResult with extraction trace, risk assessment and eligibility
     */
    public AnnotationResult annotate(String sourceId, String narrative) {
        ExtractionResult extraction = extractor.extract(narrative);
        RiskProfile profile = RiskProfile.from(extraction.getState()).build();
        boolean lipidTopic = topicDetector.mentionsLipidTopic(narrative);
        return decide(sourceId, extraction, profile, lipidTopic);
    }

    /**
     * Assess an already structured patient, e.g. one mapped from FHIR resources.
     * Structured lipid data always counts as a lipid topic.
     * @param sourceId Label for the input (patient id); may be null
     * @param state Patient state driving eligibility
     * @param profile Risk profile driving classification
     * @return AnnotationResult with an empty extraction trace
     */
    public AnnotationResult assess(String sourceId, PatientState state, RiskProfile profile) {
        if (state == null || profile == null) {
            throw new IllegalArgumentException("PatientState and RiskProfile cannot be null");
        }
        return decide(sourceId, new ExtractionResult(state, new ExtractionTrace(null)), profile, true);
    }

    private AnnotationResult decide(String sourceId, ExtractionResult extraction, RiskProfile profile,
                                    boolean lipidTopic) {
        RiskAssessment risk = riskClassifier.classify(profile);
        EligibilityResult eligibility = eligibilityEvaluator.evaluate(extraction.getState());

        logger.debug("Annotated {}: risk={}, eligible={}", sourceId, risk.getCategory().getId(), eligibility.isEligible());
        return new AnnotationResult(sourceId, extraction, profile, risk, eligibility, lipidTopic);
    }
}
