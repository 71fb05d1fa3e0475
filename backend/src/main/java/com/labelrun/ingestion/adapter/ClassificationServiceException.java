package com.labelrun.ingestion.adapter;

/**
 * Thrown when a classification call fails: transport error, unparseable body or schema violation.
 * All three are retried identically.
 */
public class ClassificationServiceException extends RuntimeException {

    public ClassificationServiceException(String message) {
        super(message);
    }

    public ClassificationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
