package com.actexport.core.output;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One rendered document ready to be written.
 *
 * @param relativePath relative path for the file (e.g., "act_20240101_120000.md")
 * @param content encoded file content
 * @param contentType MIME type of the content
 */
public record ExportedFile(
    String relativePath,
    byte[] content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public ExportedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns whether the content is text that can be printed as is.
     *
     * @return true for {@code text/*} content types
     */
    public boolean isText() {
        return contentType != null && contentType.startsWith("text/");
    }

    /**
     * Decodes the content as UTF-8.
     *
     * @return content as string
     */
    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int size() {
        return content.length;
    }
}
