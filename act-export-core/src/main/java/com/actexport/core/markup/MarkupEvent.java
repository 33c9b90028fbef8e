package com.actexport.core.markup;

import java.util.Set;

/**
 * One event of the inline markup token stream.
 *
 * @param type event type
 * @param styles styles switched on by an OPEN event or off by the matching CLOSE event
 * @param text text of a TEXT event, empty otherwise
 */
public record MarkupEvent(
    Type type,
    Set<InlineStyle> styles,
    String text
) {
    /**
     * Event types.
     */
    public enum Type {
        OPEN,
        CLOSE,
        TEXT,
        LINE_BREAK,
        PARAGRAPH_BREAK
    }

    /**
     * Compact constructor normalizing nulls.
     */
    public MarkupEvent {
        styles = styles == null ? Set.of() : Set.copyOf(styles);
        text = text == null ? "" : text;
    }

    public static MarkupEvent open(Set<InlineStyle> styles) {
        return new MarkupEvent(Type.OPEN, styles, null);
    }

    public static MarkupEvent close(Set<InlineStyle> styles) {
        return new MarkupEvent(Type.CLOSE, styles, null);
    }

    public static MarkupEvent text(String text) {
        return new MarkupEvent(Type.TEXT, null, text);
    }

    public static MarkupEvent lineBreak() {
        return new MarkupEvent(Type.LINE_BREAK, null, null);
    }

    public static MarkupEvent paragraphBreak() {
        return new MarkupEvent(Type.PARAGRAPH_BREAK, null, null);
    }
}
