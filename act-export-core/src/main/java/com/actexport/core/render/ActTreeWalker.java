package com.actexport.core.render;

import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.TextBlock;
import com.actexport.core.model.Violation;
import com.actexport.core.tree.ActTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The one tree walk shared by every output format.
 *
 * <p>Depth-first, pre-order. Each node is reported with its level and the number of its
 * nearest enclosing item, then its children are visited. Table, text block and violation
 * nodes are resolved against the satellite maps of {@link ActData}; a node whose
 * reference is missing or points at an absent entity is skipped without error, but its
 * children are still walked.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ActTreeWalker.walkChildren(data.tree(), data, sink);   // full document, root not reported
 * ActTreeWalker.walk(subtree, data, sink, "5");         // detached subtree under item 5
 * }</pre>
 */
public final class ActTreeWalker {

    private static final Logger log = LoggerFactory.getLogger(ActTreeWalker.class);

    private ActTreeWalker() {
    }

    /**
     * Walks the children of a node at level 1. The node itself is not reported.
     *
     * @param parent node whose children are walked, typically the root
     * @param data act snapshot used to resolve references
     * @param sink receiver
     */
    public static void walkChildren(ActNode parent, ActData data, ActNodeSink sink) {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        String number = numberOf(parent, null);
        for (ActNode child : parent.children()) {
            visit(child, 1, number, data, sink);
        }
    }

    /**
     * Walks a node and its descendants, reporting the node itself at level 1.
     *
     * @param start first node to report
     * @param data act snapshot used to resolve references
     * @param sink receiver
     * @param inheritedNumber number of the item enclosing {@code start}, may be null
     */
    public static void walk(ActNode start, ActData data, ActNodeSink sink, String inheritedNumber) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        visit(start, 1, inheritedNumber, data, sink);
    }

    private static void visit(ActNode node, int level, String carried, ActData data, ActNodeSink sink) {
        String number = numberOf(node, carried);
        NodeContext context = new NodeContext(level, number);

        switch (node.type()) {
            case ITEM -> sink.onItem(node, context);
            case TABLE -> {
                ActTable table = data.table(node.satelliteId());
                if (table != null) {
                    sink.onTable(node, table, context);
                } else {
                    log.debug("Skipping table node {}: table '{}' not found", node.id(), node.tableId());
                }
            }
            case TEXTBLOCK -> {
                TextBlock textBlock = data.textBlock(node.satelliteId());
                if (textBlock != null) {
                    sink.onTextBlock(node, textBlock, context);
                } else {
                    log.debug("Skipping text block node {}: text block '{}' not found",
                        node.id(), node.textBlockId());
                }
            }
            case VIOLATION -> {
                Violation violation = data.violation(node.satelliteId());
                if (violation != null) {
                    sink.onViolation(node, violation, context);
                } else {
                    log.debug("Skipping violation node {}: violation '{}' not found",
                        node.id(), node.violationId());
                }
            }
        }

        for (ActNode child : node.children()) {
            visit(child, level + 1, number, data, sink);
        }
    }

    private static String numberOf(ActNode node, String carried) {
        if (node.isItem() && node.hasNumber()) {
            return ActTree.normalizeNumber(node.number());
        }
        return carried == null ? null : ActTree.normalizeNumber(carried);
    }
}
