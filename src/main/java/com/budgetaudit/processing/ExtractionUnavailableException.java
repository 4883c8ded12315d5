package com.budgetaudit.processing;

/**
 * The document handed to a job has no usable text. The job fails without running any detector.
 */
public class ExtractionUnavailableException extends RuntimeException {

    public ExtractionUnavailableException(String message) {
        super(message);
    }
}
