package com.scriptplatform.common.exception;

/**
 * Malformed caller input: blank script text, negative or non-finite metrics,
 * unknown platform on a store operation. Never retried.
 */
public class ValidationException extends ScoringException {

    public ValidationException(String operation, String message) {
        super(operation, message);
    }
}
