package com.scriptplatform.common.exception;

/**
 * The operation is well-formed but the state it depends on is missing, e.g. saving a
 * draft that was never rescored or ingesting against an unknown snapshot.
 * Nothing is written when this is raised.
 */
public class PreconditionFailedException extends ScoringException {

    public PreconditionFailedException(String operation, String message) {
        super(operation, message);
    }
}
