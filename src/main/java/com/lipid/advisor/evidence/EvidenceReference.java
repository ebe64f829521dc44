package com.lipid.advisor.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Citation metadata for one evidence id. Quote is null where the source wording
 * was not available verbatim; the note then explains the operational definition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EvidenceReference {
    private final String id;
    private final EvidenceCategory category;
    private final String guideline;
    private final Integer year;
    private final String section;
    private final String appliesTo;
    private final String summary;
    private final String quote;
    private final String note;

    @JsonCreator
    public EvidenceReference(@JsonProperty("id") String id,
                             @JsonProperty("category") EvidenceCategory category,
                             @JsonProperty("guideline") String guideline,
                             @JsonProperty("year") Integer year,
                             @JsonProperty("section") String section,
                             @JsonProperty("appliesTo") String appliesTo,
                             @JsonProperty("summary") String summary,
                             @JsonProperty("quote") String quote,
                             @JsonProperty("note") String note) {
        this.id = Objects.requireNonNull(id, "id");
        this.category = Objects.requireNonNull(category, "category");
        this.guideline = Objects.requireNonNull(guideline, "guideline");
        this.year = year;
        this.section = section;
        this.appliesTo = appliesTo;
        this.summary = summary;
        this.quote = quote;
        this.note = note;
    }

    public String getId() {
        return id;
    }

    public EvidenceCategory getCategory() {
        return category;
    }

    public String getGuideline() {
        return guideline;
    }

    public Optional<Integer> getYear() {
        return Optional.ofNullable(year);
    }

    public Optional<String> getSection() {
        return Optional.ofNullable(section);
    }

    public Optional<String> getAppliesTo() {
        return Optional.ofNullable(appliesTo);
    }

    public Optional<String> getSummary() {
        return Optional.ofNullable(summary);
    }

    public Optional<String> getQuote() {
        return Optional.ofNullable(quote);
    }

    public Optional<String> getNote() {
        return Optional.ofNullable(note);
    }

    /**
     * @return Short citation such as "ESC/EAS Dyslipidaemia Guideline – Focused Update 2025, Table 3"
     */
    public String citation() {
        StringBuilder sb = new StringBuilder(guideline);
        if (year != null && !guideline.contains(String.valueOf(year))) {
            sb.append(' ').append(year);
        }
        if (section != null) {
            sb.append(", ").append(section);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvidenceReference other)) {
            return false;
        }
        return id.equals(other.id) && category == other.category && guideline.equals(other.guideline)
                && Objects.equals(year, other.year) && Objects.equals(section, other.section)
                && Objects.equals(appliesTo, other.appliesTo) && Objects.equals(summary, other.summary)
                && Objects.equals(quote, other.quote) && Objects.equals(note, other.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, guideline, year, section, appliesTo, summary, quote, note);
    }

    @Override
    public String toString() {
        return id + " [" + citation() + "]";
    }
}
