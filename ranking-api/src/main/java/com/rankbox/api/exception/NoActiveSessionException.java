package com.rankbox.api.exception;

/**
 * Thrown when an endpoint needs a ranking session and none has been started.
 */
public class NoActiveSessionException extends RuntimeException {

    public NoActiveSessionException() {
        super("No ranking session is active. Start one with POST /api/ranking/session");
    }
}
