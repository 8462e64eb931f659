package com.scriptplatform.optimizer.client;

public final class UserHeaders {

    /** Opaque user id resolved by the identity collaborator. */
    public static final String USER_ID = "X-User-Id";

    private UserHeaders() {}
}
