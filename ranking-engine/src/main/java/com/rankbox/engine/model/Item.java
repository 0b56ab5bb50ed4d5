package com.rankbox.engine.model;

import java.util.Objects;

/**
 * An item being ranked. Supplied once at session start and never changed afterwards.
 */
public record Item(
        String id,
        String title,
        String year,
        String imageUrl
) {
    public Item {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Item id must not be blank");
        }
    }

    public Item(String id, String title) {
        this(id, title, null, null);
    }

    public String getDisplayName() {
        if (title == null || title.isBlank()) return id;
        return year == null || year.isBlank() ? title : title + " (" + year + ")";
    }
}
