package com.scriptplatform.common.exception;

/**
 * Root of the engine's unchecked exception taxonomy.
 *
 * <p>Every exception carries the name of the operation that raised it so that
 * log lines and error bodies read the same way across services.
 */
public class ScoringException extends RuntimeException {
    private final String operation;

    public ScoringException(String operation, String message) {
        super("[" + operation + "] " + message);
        this.operation = operation;
    }

    public ScoringException(String operation, String message, Throwable cause) {
        super("[" + operation + "] " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
