package com.lipid.advisor.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered set of literal substrings and word-bounded abbreviations.
 * Free-form phrases match as plain substrings; short ambiguous abbreviations
 * are anchored on word boundaries. Expects already normalized text.
 */
public final class TermSet {
    private final List<Term> terms;

    private TermSet(List<Term> terms) {
        this.terms = List.copyOf(terms);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param text Normalized text
     * @return true when any term occurs in the text
     */
    public boolean matches(String text) {
        return firstMatch(text).isPresent();
    }

    /**
     * Find the first term, in configured order, that occurs in the text
     * @param text Normalized text
     * @return The matching term's description, or empty
     */
    public Optional<String> firstMatch(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Term term : terms) {
            if (term.occursIn(text)) {
                return Optional.of(term.describe());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return terms.size();
    }

    private interface Term {
        boolean occursIn(String text);

        String describe();
    }

    private static final class Literal implements Term {
        private final String value;

        private Literal(String value) {
            this.value = value;
        }

        @Override
        public boolean occursIn(String text) {
            return text.contains(value);
        }

        @Override
        public String describe() {
            return "\"" + value + "\"";
        }
    }

    private static final class Bounded implements Term {
        private final String word;
        private final Pattern pattern;

        private Bounded(String word) {
            this.word = word;
            this.pattern = Pattern.compile("\\b" + Pattern.quote(word) + "\\b");
        }

        @Override
        public boolean occursIn(String text) {
            Matcher matcher = pattern.matcher(text);
            return matcher.find();
        }

        @Override
        public String describe() {
            return "\\b" + word + "\\b";
        }
    }

    public static final class Builder {
        private final List<Term> terms = new ArrayList<>();

        private Builder() {
        }

        /**
         * Add plain substrings
         */
        public Builder literals(String... values) {
            for (String value : values) {
                terms.add(new Literal(TextNormalizer.normalize(value)));
            }
            return this;
        }

        /**
         * Add whole-word abbreviations such as "htn" or "pci"
         */
        public Builder words(String... values) {
            for (String value : values) {
                terms.add(new Bounded(TextNormalizer.normalize(value)));
            }
            return this;
        }

        public TermSet build() {
            return new TermSet(terms);
        }
    }
}
