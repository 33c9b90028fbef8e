package com.actexport.core.model;

import java.util.List;

/**
 * Optional additional content of a violation: cases, images and free text.
 *
 * @param enabled whether the section is switched on
 * @param items entries in stored order
 */
public record AdditionalContent(
    boolean enabled,
    List<ContentItem> items
) {
    /**
     * Compact constructor dropping null entries.
     */
    public AdditionalContent {
        items = items == null
            ? List.of()
            : items.stream().filter(item -> item != null).toList();
    }

    public static AdditionalContent disabled() {
        return new AdditionalContent(false, List.of());
    }
}
