package com.actexport.core.render;

import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.tree.ActTree;
import com.actexport.core.tree.SubtreeOptions;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Interface for renderers that turn an act snapshot into one output format.
 *
 * <p>Renderers walk the act tree with {@link ActTreeWalker} and only decide how each node
 * looks in their target: plain text, Markdown or a DOCX document. Rendering is a pure
 * function of the {@link ActData} snapshot and the {@link RenderOptions}; implementations
 * are stateless and perform no I/O while rendering.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlainTextRenderer extends AbstractActRenderer<String> {
 *     @Override
 *     public String getId() {
 *         return "text";
 *     }
 *
 *     @Override
 *     protected DocumentSink<String> createSink(RenderOptions options, boolean full) {
 *         return new TextSink(options);
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.actexport.core.render.ActRenderer}
 *
 * @param <T> rendered output type: {@code String} for text formats, a document object for
 *            binary formats
 * @see ActTreeWalker
 * @see RenderOptions
 */
public interface ActRenderer<T> {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used to select the format on the command line and in configuration. Lowercase
     * (e.g., "text", "markdown", "docx").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for rendered output.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns the MIME type of the encoded output.
     *
     * @return content type
     */
    String getContentType();

    /**
     * Renders a whole act: the title, then every child of the root.
     *
     * <p>Content problems (missing satellites, malformed spans, broken markup) never cause
     * an exception; they degrade as documented on the individual formatters.
     *
     * @param data act snapshot
     * @param options render options, null for defaults
     * @return rendered document
     * @throws NullPointerException if data is null
     */
    T renderFull(ActData data, RenderOptions options);

    /**
     * Renders a node and its (already pruned) descendants without a title.
     *
     * <p>Numbers of table, text block and violation captions are resolved through the
     * items enclosing {@code node} in {@code data.tree()}.
     *
     * @param node node to render, typically from {@link ActTree#extractSubtree}
     * @param data act snapshot used to resolve references
     * @param options render options, null for defaults
     * @return rendered document
     */
    T renderNode(ActNode node, ActData data, RenderOptions options);

    /**
     * Serializes rendered output for writing to a file.
     *
     * @param rendered output of this renderer
     * @return encoded bytes
     * @throws IOException if serialization fails
     */
    byte[] encode(T rendered) throws IOException;

    /**
     * Extracts the item with the given number and renders it.
     *
     * @param data act snapshot
     * @param number item number, trailing dots ignored
     * @param subtree how much of the item to keep
     * @param options render options, null for defaults
     * @return rendered subtree, or empty if no item carries the number
     */
    default Optional<T> renderSubtree(ActData data, String number, SubtreeOptions subtree, RenderOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        return ActTree.extractSubtree(data.tree(), number, subtree)
            .map(node -> renderNode(node, data, options));
    }

    /**
     * Renders several subtrees in one call.
     *
     * @param data act snapshot
     * @param numbers item numbers, in the order wanted
     * @param subtree how much of each item to keep
     * @param options render options, null for defaults
     * @return number to rendered subtree; numbers that are not found map to empty
     */
    default Map<String, Optional<T>> renderSubtrees(ActData data, List<String> numbers, SubtreeOptions subtree,
                                                    RenderOptions options) {
        Objects.requireNonNull(numbers, "numbers must not be null");
        Map<String, Optional<T>> results = new LinkedHashMap<>();
        for (String number : numbers) {
            results.put(number, renderSubtree(data, number, subtree, options));
        }
        return results;
    }
}
