package com.actexport.core.model;

import java.util.Locale;

/**
 * Kind of an additional content entry of a violation.
 */
public enum ContentItemType {
    CASE,
    IMAGE,
    FREE_TEXT;

    /**
     * Resolves a stored type name ({@code case}, {@code image}, {@code freeText}).
     *
     * @param value stored value; may be null
     * @return matching type, or {@link #FREE_TEXT} when absent or unknown
     */
    public static ContentItemType fromWireName(String value) {
        if (value == null) {
            return FREE_TEXT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "case" -> CASE;
            case "image" -> IMAGE;
            default -> FREE_TEXT;
        };
    }
}
