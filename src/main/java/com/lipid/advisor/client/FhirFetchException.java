package com.lipid.advisor.client;

/**
 * Thrown when a patient's resources cannot be retrieved completely, so that an
 * incomplete record is never assessed as if it were the whole chart
 */
public class FhirFetchException extends RuntimeException {

    public FhirFetchException(String message) {
        super(message);
    }

    public FhirFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
