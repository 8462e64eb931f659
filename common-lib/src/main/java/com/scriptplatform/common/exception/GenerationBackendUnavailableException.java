package com.scriptplatform.common.exception;

/**
 * Raised by generation backends when no text can be produced. Always caught by the
 * variant generator and converted into a template fallback.
 */
public class GenerationBackendUnavailableException extends ScoringException {

    public GenerationBackendUnavailableException(String message) {
        super("generate_text", message);
    }

    public GenerationBackendUnavailableException(String message, Throwable cause) {
        super("generate_text", message, cause);
    }
}
