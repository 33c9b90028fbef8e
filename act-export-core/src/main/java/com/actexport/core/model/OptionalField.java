package com.actexport.core.model;

/**
 * Tri-state optional text field of a violation.
 *
 * @param enabled whether the field is switched on
 * @param content field text
 */
public record OptionalField(
    boolean enabled,
    String content
) {
    /**
     * Compact constructor normalizing content.
     */
    public OptionalField {
        if (content == null) {
            content = "";
        }
    }

    public static OptionalField disabled() {
        return new OptionalField(false, "");
    }

    public static OptionalField of(String content) {
        return new OptionalField(true, content);
    }

    /**
     * Returns whether the field should be rendered.
     *
     * @return true when enabled and the content is not blank
     */
    public boolean isPresent() {
        return enabled && !content.isBlank();
    }
}
