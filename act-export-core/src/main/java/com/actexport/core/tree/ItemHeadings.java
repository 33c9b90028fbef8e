package com.actexport.core.tree;

import com.actexport.core.model.ActNode;

/**
 * Heading text of item nodes, shared by every output format.
 */
public final class ItemHeadings {

    private ItemHeadings() {
    }

    /**
     * Returns {@code "<number>. <label>"}, or the label alone when the item has no number
     * or the label already starts with it as a
     * whole number ({@code "5.1. Проверка"} for item {@code 5.1}, but not {@code "10 мест"} for item {@code 1}).
     *
     * @param item item node
     * @return heading text, empty when the item has neither label nor number
     */
    public static String text(ActNode item) {
        String label = item.label() == null ? "" : item.label().trim();
        if (!item.hasNumber()) {
            return label;
        }
        String number = ActTree.normalizeNumber(item.number());
        if (startsWithNumber(label, number)) {
            return label;
        }
        return label.isEmpty() ? number + "." : number + ". " + label;
    }

    private static boolean startsWithNumber(String label, String number) {
        if (!label.startsWith(number)) {
            return false;
        }
        if (label.length() == number.length()) {
            return true;
        }
        char next = label.charAt(number.length());
        return next == '.' || Character.isWhitespace(next);
    }
}
