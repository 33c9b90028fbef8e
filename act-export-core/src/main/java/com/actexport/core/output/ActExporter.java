package com.actexport.core.output;

import com.actexport.core.model.ActData;
import com.actexport.core.render.ActRenderer;
import com.actexport.core.render.RenderOptions;
import com.actexport.core.tree.ActTree;
import com.actexport.core.tree.SubtreeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point for exporting acts into files.
 *
 * <p>Renderers are discovered via {@link ServiceLoader} and selected by id
 * ({@code text}, {@code markdown}, {@code docx}). Each export is rendered, encoded and
 * packaged as an {@link ExportedFile} ready for an {@link OutputWriter}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ActExporter exporter = new ActExporter();
 * ExportedFile docx = exporter.renderFull("docx", data, RenderOptions.defaults());
 *
 * Optional<ExportedFile> section = exporter.renderSubtree(
 *     "markdown", data, "5.1", SubtreeOptions.full(), RenderOptions.defaults());
 * }</pre>
 *
 * @see ActRenderer
 */
public class ActExporter {

    private static final Logger log = LoggerFactory.getLogger(ActExporter.class);

    private final Map<String, ActRenderer<?>> renderers;
    private final ExportFileNames fileNames;

    /**
     * Creates an exporter with all renderers registered on the classpath.
     */
    public ActExporter() {
        this(discoverRenderers(), new ExportFileNames());
    }

    /**
     * Creates an exporter with renderers discovered on the classpath and custom file names.
     *
     * @param fileNames file name builder
     */
    public ActExporter(ExportFileNames fileNames) {
        this(discoverRenderers(), fileNames);
    }

    /**
     * Creates an exporter with an explicit renderer list.
     *
     * @param renderers renderers; the first one registered for an id wins
     * @param fileNames file name builder
     */
    public ActExporter(List<ActRenderer<?>> renderers, ExportFileNames fileNames) {
        Objects.requireNonNull(renderers, "renderers must not be null");
        this.fileNames = Objects.requireNonNull(fileNames, "fileNames must not be null");
        this.renderers = new LinkedHashMap<>();
        for (ActRenderer<?> renderer : renderers) {
            this.renderers.putIfAbsent(renderer.getId(), renderer);
        }
    }

    /**
     * Returns the available renderers in discovery order.
     *
     * @return renderers
     */
    public List<ActRenderer<?>> renderers() {
        return List.copyOf(renderers.values());
    }

    /**
     * Looks up a renderer by format id.
     *
     * @param format format id, case-insensitive
     * @return renderer
     * @throws IllegalArgumentException if no renderer has this id
     */
    public ActRenderer<?> renderer(String format) {
        String id = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        ActRenderer<?> renderer = renderers.get(id);
        if (renderer == null) {
            throw new IllegalArgumentException("Unsupported export format: " + format);
        }
        return renderer;
    }

    /**
     * Renders the whole act.
     *
     * @param format format id
     * @param data snapshot
     * @param options render options, null for defaults
     * @return exported file
     * @throws IllegalArgumentException if the format is unknown
     */
    public ExportedFile renderFull(String format, ActData data, RenderOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        ActRenderer<?> renderer = renderer(format);
        log.info("Exporting act as {}", renderer.getId());
        return exportFull(renderer, data, options);
    }

    /**
     * Renders the subtree under one item number.
     *
     * @param format format id
     * @param data snapshot
     * @param number item number to extract
     * @param subtree extraction options
     * @param options render options, null for defaults
     * @return exported file, or empty if no item has this number
     * @throws IllegalArgumentException if the format is unknown
     */
    public Optional<ExportedFile> renderSubtree(String format, ActData data, String number,
                                                SubtreeOptions subtree, RenderOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        ActRenderer<?> renderer = renderer(format);
        log.info("Exporting item {} as {}", number, renderer.getId());
        return exportSubtree(renderer, data, number, subtree, options);
    }

    /**
     * Renders several subtrees with the same options.
     *
     * @param format format id
     * @param data snapshot
     * @param numbers item numbers in output order
     * @param subtree extraction options
     * @param options render options, null for defaults
     * @return exported files by requested number; missing numbers map to empty
     */
    public Map<String, Optional<ExportedFile>> renderSubtrees(String format, ActData data, List<String> numbers,
                                                              SubtreeOptions subtree, RenderOptions options) {
        Objects.requireNonNull(numbers, "numbers must not be null");
        Map<String, Optional<ExportedFile>> results = new LinkedHashMap<>();
        for (String number : numbers) {
            results.put(number, renderSubtree(format, data, number, subtree, options));
        }
        return results;
    }

    private <T> ExportedFile exportFull(ActRenderer<T> renderer, ActData data, RenderOptions options) {
        T rendered = renderer.renderFull(data, options);
        return toFile(renderer, rendered, fileNames.fullExport(renderer.getFileExtension()));
    }

    private <T> Optional<ExportedFile> exportSubtree(ActRenderer<T> renderer, ActData data, String number,
                                                     SubtreeOptions subtree, RenderOptions options) {
        String normalized = ActTree.normalizeNumber(number);
        return renderer.renderSubtree(data, normalized, subtree, options)
            .map(rendered -> toFile(renderer, rendered,
                fileNames.subtreeExport(normalized, renderer.getFileExtension())));
    }

    private <T> ExportedFile toFile(ActRenderer<T> renderer, T rendered, String fileName) {
        try {
            return new ExportedFile(fileName, renderer.encode(rendered), renderer.getContentType());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + renderer.getId() + " export: " + fileName, e);
        }
    }

    private static List<ActRenderer<?>> discoverRenderers() {
        log.debug("Discovering act renderers via ServiceLoader");
        List<ActRenderer<?>> found = new ArrayList<>();
        for (ActRenderer<?> renderer : ServiceLoader.load(ActRenderer.class)) {
            log.debug("Found renderer: {} ({})", renderer.getId(), renderer.getDisplayName());
            found.add(renderer);
        }
        return found;
    }
}
