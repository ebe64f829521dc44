package com.lipid.advisor.evidence;

/**
 * Thrown when the evidence table resource is missing or malformed
 */
public class EvidenceLoadException extends RuntimeException {

    public EvidenceLoadException(String message) {
        super(message);
    }

    public EvidenceLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
