package com.rankbox.engine.exception;

/**
 * Thrown when an item id has no rating record in the current session.
 */
public class MissingRecordException extends RuntimeException {

    private final String itemId;

    public MissingRecordException(String itemId) {
        super(String.format("No rating record for item: %s", itemId));
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
