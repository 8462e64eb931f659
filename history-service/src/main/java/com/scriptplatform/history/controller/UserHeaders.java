package com.scriptplatform.history.controller;

/**
 * Identity arrives from the upstream session layer as an opaque header; it only scopes
 * reads and writes and is never interpreted.
 */
public final class UserHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String ANONYMOUS = "anonymous";

    private UserHeaders() {}
}
