package com.actexport.core.output.impl;

import com.actexport.core.output.ExportBundle;
import com.actexport.core.output.ExportedFile;
import com.actexport.core.output.OutputContext;
import com.actexport.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writer that prints exported acts to the console with optional ANSI color formatting.
 *
 * <p>Text formats are printed as is; binary formats such as DOCX are summarized by name,
 * type and size.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Custom separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleOutputWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleOutputWriter.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int SEPARATOR_WIDTH = 80;

    private final PrintStream out;

    public ConsoleOutputWriter() {
        this(System.out);
    }

    public ConsoleOutputWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(ExportBundle bundle, OutputContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        if (separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));

        logger.debug("Printing {} files to console (colors: {}, headers: {})",
            bundle.files().size(), useColors, showHeaders);

        int total = bundle.files().size();
        for (int i = 0; i < total; i++) {
            ExportedFile file = bundle.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            printFileContent(file, useColors);
            if (i < total - 1) {
                printSeparator(separator, useColors);
            }
        }
        out.flush();
    }

    private void printFileHeader(ExportedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println(metaColor + "Type: " + file.contentType() + reset);
        }
        out.println(metaColor + "Size: " + file.size() + " bytes" + reset);
        out.println();
    }

    private void printFileContent(ExportedFile file, boolean useColors) {
        if (file.isText()) {
            out.print(file.contentAsString());
            return;
        }
        String color = useColors ? ANSI_GREEN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(color + "[binary content: " + file.relativePath() + ", " + file.size() + " bytes]" + reset);
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        int repeatCount = Math.max(1, SEPARATOR_WIDTH / separator.length());
        out.println();
        out.println(color + separator.repeat(repeatCount) + reset);
        out.println();
    }
}
