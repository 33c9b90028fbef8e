package com.actexport.core.model;

import java.util.Objects;

/**
 * Rich-text satellite entity.
 *
 * @param id text block id
 * @param content inline markup (bold, italic, underline, line breaks)
 * @param formatting paragraph formatting
 */
public record TextBlock(
    String id,
    String content,
    TextFormatting formatting
) {
    /**
     * Compact constructor with validation.
     */
    public TextBlock {
        Objects.requireNonNull(id, "id must not be null");
        if (content == null) {
            content = "";
        }
        if (formatting == null) {
            formatting = TextFormatting.defaults();
        }
    }
}
