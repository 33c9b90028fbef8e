package com.actexport.core.model;

import java.util.List;

/**
 * Optional list of description lines of a violation.
 *
 * @param enabled whether the list is switched on
 * @param items ordered description lines
 */
public record DescriptionList(
    boolean enabled,
    List<String> items
) {
    /**
     * Compact constructor dropping null entries.
     */
    public DescriptionList {
        items = items == null
            ? List.of()
            : items.stream().filter(item -> item != null).toList();
    }

    public static DescriptionList disabled() {
        return new DescriptionList(false, List.of());
    }
}
