package com.actexport.core.render;

import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.TextBlock;
import com.actexport.core.model.Violation;

/**
 * Receives the nodes of a tree walk, one callback per node type.
 *
 * <p>{@link ActTreeWalker} calls these in pre-order. Satellite entities are already
 * resolved; nodes whose reference cannot be resolved are never reported.
 */
public interface ActNodeSink {

    /**
     * Called for an item node, before any of its children.
     *
     * @param item item node
     * @param context depth and the number of the item itself
     */
    void onItem(ActNode item, NodeContext context);

    /**
     * Called for a table node.
     *
     * @param node table node
     * @param table resolved table
     * @param context depth and the number of the nearest enclosing item
     */
    void onTable(ActNode node, ActTable table, NodeContext context);

    /**
     * Called for a text block node.
     *
     * @param node text block node
     * @param textBlock resolved text block
     * @param context depth and the number of the nearest enclosing item
     */
    void onTextBlock(ActNode node, TextBlock textBlock, NodeContext context);

    /**
     * Called for a violation node.
     *
     * @param node violation node
     * @param violation resolved violation
     * @param context depth and the number of the nearest enclosing item
     */
    void onViolation(ActNode node, Violation violation, NodeContext context);
}
