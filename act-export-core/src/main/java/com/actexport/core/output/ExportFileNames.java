package com.actexport.core.output;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Builds names of exported files: {@code <prefix>_<yyyyMMdd_HHmmss>.<ext>}.
 *
 * <p>Subtree exports insert the item number: {@code act_5.1_20240101_120000.md}.
 */
public class ExportFileNames {

    public static final String DEFAULT_PREFIX = "act";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String prefix;
    private final Clock clock;

    public ExportFileNames() {
        this(DEFAULT_PREFIX, Clock.systemDefaultZone());
    }

    /**
     * Creates a name builder.
     *
     * @param prefix file name prefix; null or blank falls back to {@link #DEFAULT_PREFIX}
     * @param clock clock supplying the timestamp
     */
    public ExportFileNames(String prefix, Clock clock) {
        this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Returns the name of a full export.
     *
     * @param extension file extension without the dot
     * @return file name
     */
    public String fullExport(String extension) {
        return prefix + "_" + timestamp() + "." + extension;
    }

    /**
     * Returns the name of a subtree export.
     *
     * @param number extracted item number
     * @param extension file extension without the dot
     * @return file name
     */
    public String subtreeExport(String number, String extension) {
        return prefix + "_" + number + "_" + timestamp() + "." + extension;
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }
}
