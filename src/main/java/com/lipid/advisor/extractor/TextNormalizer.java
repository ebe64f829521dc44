package com.lipid.advisor.extractor;

import java.util.Locale;

/**
 * Canonicalizes narrative text before pattern matching
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Unify line endings and full-width punctuation, collapse non-breaking spaces and lower-case.
     * @param raw Raw narrative text, may be null
     * @return Normalized text, never null
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return raw
                .replace('\r', '\n')
                .replace('，', ',')
                .replace('、', ',')
                .replace('：', ':')
                .replace('\u00A0', ' ')
                .toLowerCase(Locale.ROOT);
    }
}
