package com.actexport.core.model;

import java.util.Locale;

/**
 * Kind of a node in the act tree.
 *
 * <p>The type decides which satellite reference of an {@link ActNode} is meaningful:
 * tables carry {@code tableId}, text blocks {@code textBlockId}, violations
 * {@code violationId}; items carry none and are the only nodes with a number.
 */
public enum NodeType {
    ITEM("item"),
    TABLE("table"),
    TEXTBLOCK("textblock"),
    VIOLATION("violation");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used in stored act snapshots.
     *
     * @return lowercase wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a stored type name.
     *
     * @param value wire name, case-insensitive; may be null
     * @return matching type, or {@link #ITEM} when the value is absent or unknown
     */
    public static NodeType fromWireName(String value) {
        if (value == null) {
            return ITEM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return ITEM;
    }
}
