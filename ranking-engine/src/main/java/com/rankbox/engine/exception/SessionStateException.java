package com.rankbox.engine.exception;

/**
 * Thrown when an operation does not fit the session's current state, for example resolving
 * a comparison before a session has started or after it has finished.
 */
public class SessionStateException extends RuntimeException {

    public SessionStateException(String message) {
        super(message);
    }
}
