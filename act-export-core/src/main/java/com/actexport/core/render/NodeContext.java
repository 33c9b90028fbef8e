package com.actexport.core.render;

import com.actexport.core.model.ActNode;

/**
 * Position of a node during a tree walk.
 *
 * @param level depth below the walk start; the first rendered level is 1
 * @param itemNumber number of the nearest enclosing item (the node's own for items), may be null
 */
public record NodeContext(
    int level,
    String itemNumber
) {
    /**
     * Returns whether an item number is known.
     *
     * @return true if present and not blank
     */
    public boolean hasItemNumber() {
        return itemNumber != null && !itemNumber.isBlank();
    }

    /**
     * Builds the caption line of a table, text block or violation node.
     *
     * @param node node being rendered
     * @param defaultCaption caption used when the node has no custom label
     * @return caption such as {@code Таблица (пункт 5.1)}
     */
    public String caption(ActNode node, String defaultCaption) {
        String base = node.customLabel() != null && !node.customLabel().isBlank()
            ? node.customLabel().trim()
            : defaultCaption;
        return hasItemNumber() ? base + " (пункт " + itemNumber + ")" : base;
    }
}
