package com.rankbox.engine.exception;

/**
 * Thrown when no valid pair or group can be formed. Terminal for the session.
 */
public class SelectionFailureException extends RuntimeException {

    public SelectionFailureException(String message) {
        super(message);
    }

    public static SelectionFailureException notEnoughItems(int itemCount) {
        return new SelectionFailureException(
                String.format("Unable to continue ranking: need at least 2 items, have %d", itemCount));
    }
}
