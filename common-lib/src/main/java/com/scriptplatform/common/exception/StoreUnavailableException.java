package com.scriptplatform.common.exception;

/**
 * Persistence failure on an append. Surfaced to the caller, who retries the whole
 * logical operation; retries of {@code save} are not deduplicated.
 */
public class StoreUnavailableException extends ScoringException {

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
