package com.scriptplatform.common.exception;

public class ResourceNotFoundException extends ScoringException {

    public ResourceNotFoundException(String operation, String message) {
        super(operation, message);
    }
}
