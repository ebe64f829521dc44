package com.lipid.advisor.extractor;

/**
 * Decides whether a narrative discusses lipids, so that lipid evidence is only
 * attached to reports where it is relevant.
 */
public class LipidTopicDetector {

    private static final TermSet LIPID_TERMS = TermSet.builder()
        .literals("ldl", "cholesterol", "lipid", "statin", "ezetimibe", "pcsk9", "bempedoic",
            "lp(a)", "lpa", "hyperlipidem", "dyslip")
        .literals("健保", "給付", "高血脂", "膽固醇", "降脂", "依折麥布")
        .build();

    /**
     * @param texts Raw texts to inspect (e.g. narrative and chief complaint); nulls are ignored
     * @return true when any text mentions a lipid topic
     */
    public boolean mentionsLipidTopic(String... texts) {
        StringBuilder combined = new StringBuilder();
        for (String text : texts) {
            if (text != null) {
                combined.append(text).append('\n');
            }
        }
        return LIPID_TERMS.matches(TextNormalizer.normalize(combined.toString()));
    }
}
