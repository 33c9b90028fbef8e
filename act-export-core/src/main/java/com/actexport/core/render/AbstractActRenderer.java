package com.actexport.core.render;

import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.tree.ActTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class that drives the shared walk for every renderer.
 *
 * <p>Subclasses provide a fresh {@link DocumentSink} per call, so renderers hold no state
 * between calls.
 *
 * @param <T> output type
 */
public abstract class AbstractActRenderer<T> implements ActRenderer<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractActRenderer.class);

    /**
     * Creates the sink for one render call.
     *
     * @param options effective options
     * @param full true for a full render with title, false for a subtree
     * @return new sink
     */
    protected abstract DocumentSink<T> createSink(RenderOptions options, boolean full);

    @Override
    public T renderFull(ActData data, RenderOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        RenderOptions effective = options == null ? RenderOptions.defaults() : options;
        log.debug("Rendering full act as {} ({} tables, {} text blocks, {} violations)",
            getId(), data.tables().size(), data.textBlocks().size(), data.violations().size());

        DocumentSink<T> sink = createSink(effective, true);
        sink.onTitle(effective.title());
        ActTreeWalker.walkChildren(data.tree(), data, sink);
        return sink.finish();
    }

    @Override
    public T renderNode(ActNode node, ActData data, RenderOptions options) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(data, "data must not be null");
        RenderOptions effective = options == null ? RenderOptions.defaults() : options;
        String inherited = ActTree.findNearestAncestorItemNumber(data.tree(), node.id()).orElse(null);
        log.debug("Rendering node {} as {} (inherited number: {})", node.id(), getId(), inherited);

        DocumentSink<T> sink = createSink(effective, false);
        ActTreeWalker.walk(node, data, sink, inherited);
        return sink.finish();
    }
}
