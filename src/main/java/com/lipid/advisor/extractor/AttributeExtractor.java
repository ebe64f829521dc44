package com.lipid.advisor.extractor;

import com.lipid.advisor.model.ClinicalFlag;
import com.lipid.advisor.model.ExtractionResult;
import com.lipid.advisor.model.ExtractionTrace;
import com.lipid.advisor.model.PatientState;
import com.lipid.advisor.model.Sex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a {@link PatientState} from a free-text clinical narrative.
 * Extraction is best-effort and never guesses: a field that no pattern supports stays unknown.
 */
public class AttributeExtractor {

    private static final Logger logger = LoggerFactory.getLogger(AttributeExtractor.class);

    public static final String FIELD_AGE = "age";
    public static final String FIELD_SEX = "sex";
    public static final String FIELD_LDL = "ldl";

    // "71f", "65 m", "65yo m"
    private static final Pattern COMPACT_AGE_SEX = Pattern.compile(
        "\\b(\\d{1,3})\\s*(y/o|yo|yr|yrs|year|years)?\\s*(m|f)\\b");
    private static final Pattern MALE_WORD = Pattern.compile("\\b(male|man)\\b");
    private static final Pattern FEMALE_WORD = Pattern.compile("\\b(female|woman)\\b");
    private static final Pattern AGE_LABEL = Pattern.compile("\\bage\\s*[:=]?\\s*(\\d{1,3})\\b");
    // "65-year-old", "65 yrs old", "48 yo female", "62 y/o man"
    private static final Pattern AGE_PHRASE = Pattern.compile(
        "\\b(\\d{1,3})[\\s-]*(?:(?:years?|yrs?)[\\s-]*old|y/o|yo)\\b");

    private static final String LDL_VALUE_SUFFIX = "\\s*[:=]?\\s*(\\d{2,3}(?:\\.\\d+)?)(?!\\d)";
    private static final List<Pattern> LDL_PATTERNS = ClinicalVocabulary.LDL_LABELS.stream()
        .map(label -> Pattern.compile(Pattern.quote(label) + LDL_VALUE_SUFFIX))
        .toList();

    /**
     * Extract patient attributes from a raw narrative
     * @param narrative Raw narrative text, may be null or empty
     * @return Extracted state plus audit trace
     */
    public ExtractionResult extract(String narrative) {
        String text = TextNormalizer.normalize(narrative);
        List<ExtractionTrace.Entry> trace = new ArrayList<>();
        PatientState.Builder state = PatientState.builder();

        extractAgeAndSex(text, state, trace);
        extractLdl(text).ifPresent(ldl -> {
            state.ldlMgdl(ldl.value);
            trace.add(new ExtractionTrace.Entry(FIELD_LDL, "label " + ldl.label, ldl.matchedText));
        });

        for (ClinicalFlag flag : ClinicalFlag.values()) {
            Optional<String> match = ClinicalVocabulary.termsFor(flag).firstMatch(text);
            if (match.isPresent()) {
                state.flag(flag);
                trace.add(new ExtractionTrace.Entry(flag.name(), match.get(), null));
            }
        }

        PatientState result = state.build();
        logger.debug("Extracted {} from narrative ({} trace entries)", result, trace.size());
        return new ExtractionResult(result, new ExtractionTrace(trace));
    }

    /**
     * Age and sex recovery. The compact token sets both; otherwise sex comes from
     * explicit words and age from an "age:" label, then from a "NN-year-old" phrase.
     */
    private void extractAgeAndSex(String text, PatientState.Builder state, List<ExtractionTrace.Entry> trace) {
        Integer age = null;
        Sex sex = null;

        Matcher compact = COMPACT_AGE_SEX.matcher(text);
        if (compact.find()) {
            age = Integer.parseInt(compact.group(1));
            sex = "m".equals(compact.group(3)) ? Sex.M : Sex.F;
            trace.add(new ExtractionTrace.Entry(FIELD_AGE, "compact age/sex token", compact.group()));
            trace.add(new ExtractionTrace.Entry(FIELD_SEX, "compact age/sex token", compact.group()));
        }

        if (sex == null) {
            Matcher male = MALE_WORD.matcher(text);
            if (male.find()) {
                sex = Sex.M;
                trace.add(new ExtractionTrace.Entry(FIELD_SEX, "sex word", male.group()));
            }
            // Explicit female wording takes precedence over male wording
            Matcher female = FEMALE_WORD.matcher(text);
            if (female.find()) {
                sex = Sex.F;
                trace.add(new ExtractionTrace.Entry(FIELD_SEX, "sex word", female.group()));
            }
        }

        if (age == null) {
            Matcher label = AGE_LABEL.matcher(text);
            if (label.find()) {
                age = Integer.parseInt(label.group(1));
                trace.add(new ExtractionTrace.Entry(FIELD_AGE, "age label", label.group()));
            }
        }

        if (age == null) {
            Matcher phrase = AGE_PHRASE.matcher(text);
            if (phrase.find()) {
                age = Integer.parseInt(phrase.group(1));
                trace.add(new ExtractionTrace.Entry(FIELD_AGE, "age phrase", phrase.group()));
            }
        }

        state.age(age).sex(sex);
    }

    private Optional<LdlMatch> extractLdl(String text) {
        for (int i = 0; i < LDL_PATTERNS.size(); i++) {
            Matcher matcher = LDL_PATTERNS.get(i).matcher(text);
            if (matcher.find()) {
                return Optional.of(new LdlMatch(
                    ClinicalVocabulary.LDL_LABELS.get(i),
                    Double.parseDouble(matcher.group(1)),
                    matcher.group()));
            }
        }
        return Optional.empty();
    }

    private static final class LdlMatch {
        private final String label;
        private final double value;
        private final String matchedText;

        private LdlMatch(String label, double value, String matchedText) {
            this.label = label;
            this.value = value;
            this.matchedText = matchedText;
        }
    }
}
