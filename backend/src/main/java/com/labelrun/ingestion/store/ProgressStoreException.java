package com.labelrun.ingestion.store;

/**
 * Thrown when a progress write or read fails. Never swallowed: losing a write would break resume.
 */
public class ProgressStoreException extends RuntimeException {

    public ProgressStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
