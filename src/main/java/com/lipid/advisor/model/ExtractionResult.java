package com.lipid.advisor.model;

import java.util.Objects;

/**
 * Patient state recovered from a narrative, with the trace explaining each value
 */
public final class ExtractionResult {
    private final PatientState state;
    private final ExtractionTrace trace;

    public ExtractionResult(PatientState state, ExtractionTrace trace) {
        this.state = Objects.requireNonNull(state, "state");
        this.trace = trace != null ? trace : new ExtractionTrace(null);
    }

    public PatientState getState() {
        return state;
    }

    public ExtractionTrace getTrace() {
        return trace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtractionResult other)) {
            return false;
        }
        return state.equals(other.state) && trace.equals(other.trace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, trace);
    }
}
