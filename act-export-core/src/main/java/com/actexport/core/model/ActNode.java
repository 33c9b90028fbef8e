package com.actexport.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One element of the act document tree.
 *
 * <p>Nodes hold only references into the satellite maps of {@link ActData}; tables,
 * text blocks and violations are never embedded. Only {@link NodeType#ITEM} nodes carry
 * a hierarchical {@code number}; the root node has none and is never rendered.
 *
 * @param id unique, stable node identifier
 * @param type node kind
 * @param label display text (items only)
 * @param content free text rendered under the heading (items only)
 * @param number hierarchical dotted number such as {@code "5.1.2"} (items only, may be null)
 * @param customLabel optional caption override for non-item nodes
 * @param children ordered children, order is display order
 * @param tableId reference into {@link ActData#tables()} when type is TABLE
 * @param textBlockId reference into {@link ActData#textBlocks()} when type is TEXTBLOCK
 * @param violationId reference into {@link ActData#violations()} when type is VIOLATION
 * @param protectedNode mutation-policy flag, ignored by rendering
 * @param deletable mutation-policy flag, ignored by rendering
 */
public record ActNode(
    String id,
    NodeType type,
    String label,
    String content,
    String number,
    String customLabel,
    List<ActNode> children,
    String tableId,
    String textBlockId,
    String violationId,
    boolean protectedNode,
    boolean deletable
) {
    /**
     * Compact constructor with validation.
     */
    public ActNode {
        Objects.requireNonNull(id, "id must not be null");
        if (type == null) {
            type = NodeType.ITEM;
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates an item node.
     *
     * @param id node id
     * @param number hierarchical number, may be null
     * @param label heading label
     * @param children child nodes
     * @return item node
     */
    public static ActNode item(String id, String number, String label, List<ActNode> children) {
        return new ActNode(id, NodeType.ITEM, label, null, number, null, children,
            null, null, null, false, true);
    }

    /**
     * Creates the unnumbered root node.
     *
     * @param children top-level nodes
     * @return root node with id {@code "root"}
     */
    public static ActNode root(List<ActNode> children) {
        return new ActNode("root", NodeType.ITEM, null, null, null, null, children,
            null, null, null, true, false);
    }

    public static ActNode table(String id, String tableId) {
        return new ActNode(id, NodeType.TABLE, null, null, null, null, List.of(),
            tableId, null, null, false, true);
    }

    public static ActNode textBlock(String id, String textBlockId) {
        return new ActNode(id, NodeType.TEXTBLOCK, null, null, null, null, List.of(),
            null, textBlockId, null, false, true);
    }

    public static ActNode violation(String id, String violationId) {
        return new ActNode(id, NodeType.VIOLATION, null, null, null, null, List.of(),
            null, null, violationId, false, true);
    }

    /**
     * Returns whether this node is an item.
     *
     * @return true for {@link NodeType#ITEM}
     */
    public boolean isItem() {
        return type == NodeType.ITEM;
    }

    /**
     * Returns the satellite id that matches this node's type.
     *
     * <p>A reference stored in a field that does not match the type is ignored.
     *
     * @return referenced satellite id, or null for items and unset references
     */
    public String satelliteId() {
        return switch (type) {
            case ITEM -> null;
            case TABLE -> tableId;
            case TEXTBLOCK -> textBlockId;
            case VIOLATION -> violationId;
        };
    }

    /**
     * Returns whether {@link #number()} is present and not blank.
     *
     * @return true if the node carries a number
     */
    public boolean hasNumber() {
        return number != null && !number.isBlank();
    }

    /**
     * Returns a copy of this node with different children.
     *
     * @param newChildren replacement children
     * @return new node
     */
    public ActNode withChildren(List<ActNode> newChildren) {
        return new ActNode(id, type, label, content, number, customLabel, newChildren,
            tableId, textBlockId, violationId, protectedNode, deletable);
    }

    /**
     * Returns a copy of this node with item content text.
     *
     * @param newContent paragraph text under the heading
     * @return new node
     */
    public ActNode withContent(String newContent) {
        return new ActNode(id, type, label, newContent, number, customLabel, children,
            tableId, textBlockId, violationId, protectedNode, deletable);
    }

    /**
     * Returns a copy of this node with a caption override.
     *
     * @param newCustomLabel caption shown instead of the default one
     * @return new node
     */
    public ActNode withCustomLabel(String newCustomLabel) {
        return new ActNode(id, type, label, content, number, newCustomLabel, children,
            tableId, textBlockId, violationId, protectedNode, deletable);
    }
}
