package com.actexport.core.model;

import java.util.Locale;

/**
 * Paragraph alignment of a text block.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    /**
     * Resolves a stored alignment name.
     *
     * @param value stored value such as {@code "center"}; may be null
     * @return matching alignment, or {@link #LEFT} when absent or unknown
     */
    public static Alignment fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return LEFT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "center" -> CENTER;
            case "right" -> RIGHT;
            case "justify" -> JUSTIFY;
            default -> LEFT;
        };
    }
}
