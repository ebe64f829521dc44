package com.lipid.advisor.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Audit trail of what the attribute extractor recovered and from which text.
 * Downstream decision logic never reads it.
 */
public final class ExtractionTrace {
    private final List<Entry> entries;

    public ExtractionTrace(List<Entry> entries) {
        this.entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * @return Entries recorded for one field, in extraction order
     */
    public List<Entry> entriesFor(String field) {
        return entries.stream()
                .filter(entry -> entry.getField().equals(field))
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExtractionTrace other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Entry {
        private final String field;
        private final String rule;
        private final String matchedText;

        public Entry(String field, String rule, String matchedText) {
            this.field = Objects.requireNonNull(field, "field");
            this.rule = Objects.requireNonNull(rule, "rule");
            this.matchedText = matchedText;
        }

        public String getField() {
            return field;
        }

        /**
         * @return The pattern or keyword that fired
         */
        public String getRule() {
            return rule;
        }

        public String getMatchedText() {
            return matchedText;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Entry other)) {
                return false;
            }
            return field.equals(other.field) && rule.equals(other.rule)
                    && Objects.equals(matchedText, other.matchedText);
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, rule, matchedText);
        }

        @Override
        public String toString() {
            return field + " <- " + rule + (matchedText != null ? " [" + matchedText + "]" : "");
        }
    }
}
