package com.actexport.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Collection of exported files to be written.
 *
 * @param files list of exported files
 */
public record ExportBundle(
    List<ExportedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public ExportBundle {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
