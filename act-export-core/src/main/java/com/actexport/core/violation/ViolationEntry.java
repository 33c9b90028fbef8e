package com.actexport.core.violation;

import java.util.List;
import java.util.Objects;

/**
 * One format-neutral section of a rendered violation.
 *
 * <p>Renderers only decorate entries; which entries exist, their labels, order and
 * numbering are decided by {@link ViolationFormatter}.
 *
 * @param kind section kind
 * @param label section label without colon, such as {@code Причины}; empty for free text
 * @param text section text; for images the caption
 * @param items list lines (LIST only)
 * @param filename image file name (IMAGE only)
 * @param url image location (IMAGE only)
 */
public record ViolationEntry(
    Kind kind,
    String label,
    String text,
    List<String> items,
    String filename,
    String url
) {
    /**
     * Section kinds, each with its own template in every target.
     */
    public enum Kind {
        /** Labelled text: {@code Label: text}. */
        FIELD,
        /** Labelled list of lines. */
        LIST,
        /** Numbered case with quoted text. */
        CASE,
        /** Image reference with caption. */
        IMAGE,
        /** Unlabelled paragraph. */
        FREE_TEXT
    }

    /**
     * Compact constructor normalizing nulls.
     */
    public ViolationEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        label = label == null ? "" : label;
        text = text == null ? "" : text;
        items = items == null ? List.of() : List.copyOf(items);
        filename = filename == null ? "" : filename;
        url = url == null ? "" : url;
    }

    static ViolationEntry field(String label, String text) {
        return new ViolationEntry(Kind.FIELD, label, text, null, null, null);
    }

    static ViolationEntry list(String label, List<String> items) {
        return new ViolationEntry(Kind.LIST, label, null, items, null, null);
    }

    static ViolationEntry caseEntry(String label, String text) {
        return new ViolationEntry(Kind.CASE, label, text, null, null, null);
    }

    static ViolationEntry image(String label, String caption, String filename, String url) {
        return new ViolationEntry(Kind.IMAGE, label, caption, null, filename, url);
    }

    static ViolationEntry freeText(String text) {
        return new ViolationEntry(Kind.FREE_TEXT, null, text, null, null, null);
    }

    /**
     * Returns the image reference line, {@code filename - caption} or the file name alone.
     *
     * @return image description
     */
    public String imageReference() {
        String name = filename.isBlank() ? url : filename;
        if (text.isBlank()) {
            return name;
        }
        return name.isBlank() ? text : name + " - " + text;
    }
}
