package com.actexport.core.config;

import com.actexport.core.output.ExportFileNames;
import com.actexport.core.render.RenderOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of act exports.
 *
 * <p>Loaded from {@code actexport.yaml}. Every section and key is optional; anything absent
 * takes the value of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * document:
 *   title: "АКТ"
 *   captions: true
 *   defaultFontSize: 14
 *
 * text:
 *   lineWidth: 100
 *   indentWidth: 4
 *
 * markdown:
 *   maxHeadingLevel: 6
 *
 * docx:
 *   maxHeadingLevel: 9
 *
 * output:
 *   directory: "./exports"
 *   filePrefix: "act"
 *   formats:
 *     - markdown
 *     - docx
 *   writers:
 *     - filesystem
 * }</pre>
 *
 * @param document document-wide settings
 * @param text plain text settings
 * @param markdown Markdown settings
 * @param docx DOCX settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExportConfig(
    @JsonProperty("document") DocumentConfig document,
    @JsonProperty("text") TextConfig text,
    @JsonProperty("markdown") MarkdownConfig markdown,
    @JsonProperty("docx") DocxConfig docx,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor replacing absent sections with empty ones.
     */
    public ExportConfig {
        document = document == null ? new DocumentConfig(null, null, null) : document;
        text = text == null ? new TextConfig(null, null) : text;
        markdown = markdown == null ? new MarkdownConfig(null) : markdown;
        docx = docx == null ? new DocxConfig(null) : docx;
        output = output == null ? new OutputConfig(null, null, null, null, null) : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return configuration with every section empty
     */
    public static ExportConfig defaults() {
        return new ExportConfig(null, null, null, null, null);
    }

    /**
     * Converts the configuration into render options, filling gaps from {@link RenderOptions#defaults()}.
     *
     * @return effective render options
     */
    public RenderOptions toRenderOptions() {
        RenderOptions defaults = RenderOptions.defaults();
        return new RenderOptions(
            document.title() != null ? document.title() : defaults.title(),
            valueOr(markdown.maxHeadingLevel(), defaults.markdownMaxHeadingLevel()),
            valueOr(docx.maxHeadingLevel(), defaults.docxMaxHeadingLevel()),
            valueOr(text.lineWidth(), defaults.lineWidth()),
            valueOr(text.indentWidth(), defaults.indentWidth()),
            valueOr(document.defaultFontSize(), defaults.defaultFontSize()),
            document.captions() != null ? document.captions() : defaults.captions()
        );
    }

    private static int valueOr(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }

    /**
     * Document-wide settings.
     *
     * @param title title of full renders
     * @param captions whether non-item nodes get a caption line
     * @param defaultFontSize DOCX font size of text without explicit formatting
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentConfig(
        @JsonProperty("title") String title,
        @JsonProperty("captions") Boolean captions,
        @JsonProperty("defaultFontSize") Integer defaultFontSize
    ) {}

    /**
     * Plain text settings.
     *
     * @param lineWidth column budget
     * @param indentWidth indentation per tree level
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TextConfig(
        @JsonProperty("lineWidth") Integer lineWidth,
        @JsonProperty("indentWidth") Integer indentWidth
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MarkdownConfig(
        @JsonProperty("maxHeadingLevel") Integer maxHeadingLevel
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocxConfig(
        @JsonProperty("maxHeadingLevel") Integer maxHeadingLevel
    ) {}

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param filePrefix prefix of exported file names
     * @param formats default export formats
     * @param writers output writer ids
     * @param settings writer-specific settings such as {@code console.colors}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("filePrefix") String filePrefix,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("writers") List<String> writers,
        @JsonProperty("settings") Map<String, String> settings
    ) {
        public static final String DEFAULT_DIRECTORY = "./exports";
        public static final List<String> DEFAULT_FORMATS = List.of("text", "markdown", "docx");
        public static final List<String> DEFAULT_WRITERS = List.of("filesystem");

        /**
         * Compact constructor filling defaults.
         */
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
            filePrefix = filePrefix == null || filePrefix.isBlank() ? ExportFileNames.DEFAULT_PREFIX : filePrefix;
            formats = formats == null || formats.isEmpty() ? DEFAULT_FORMATS : List.copyOf(formats);
            writers = writers == null || writers.isEmpty() ? DEFAULT_WRITERS : List.copyOf(writers);
            settings = settings == null ? Map.of() : Map.copyOf(settings);
        }
    }
}
