package com.lipid.advisor.evaluator;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses an LDL-C value supplied either as a number or as free text such as "LDL-C 130 mg/dL"
 */
public final class LipidValueParser {

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+(\\.\\d+)?)");

    private LipidValueParser() {
    }

    /**
     * @param raw A {@link Number}, a {@link CharSequence}, or null
     * @return The finite value, or empty when no usable number exists
     */
    public static Optional<Double> parse(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        }
        if (raw instanceof CharSequence text) {
            Matcher matcher = FIRST_NUMBER.matcher(text.toString().replace(",", ""));
            if (matcher.find()) {
                return Optional.of(Double.parseDouble(matcher.group(1)));
            }
        }
        return Optional.empty();
    }
}
