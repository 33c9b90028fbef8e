package com.actexport.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one act: the tree plus its satellite maps keyed by id.
 *
 * <p>Rendering is a pure function of this snapshot.
 *
 * @param tree root node
 * @param tables tables by id
 * @param textBlocks text blocks by id
 * @param violations violations by id
 */
public record ActData(
    ActNode tree,
    Map<String, ActTable> tables,
    Map<String, TextBlock> textBlocks,
    Map<String, Violation> violations
) {
    /**
     * Compact constructor with validation.
     */
    public ActData {
        Objects.requireNonNull(tree, "tree must not be null");
        tables = tables == null ? Map.of() : Map.copyOf(tables);
        textBlocks = textBlocks == null ? Map.of() : Map.copyOf(textBlocks);
        violations = violations == null ? Map.of() : Map.copyOf(violations);
    }

    /**
     * Creates a snapshot with no satellite entities.
     *
     * @param tree root node
     * @return snapshot
     */
    public static ActData ofTree(ActNode tree) {
        return new ActData(tree, Map.of(), Map.of(), Map.of());
    }

    /**
     * Looks up a table by id.
     *
     * @param id table id, may be null
     * @return the table, or null when the id is null or unknown
     */
    public ActTable table(String id) {
        return id == null ? null : tables.get(id);
    }

    /**
     * Looks up a text block by id.
     *
     * @param id text block id, may be null
     * @return the text block, or null when the id is null or unknown
     */
    public TextBlock textBlock(String id) {
        return id == null ? null : textBlocks.get(id);
    }

    /**
     * Looks up a violation by id.
     *
     * @param id violation id, may be null
     * @return the violation, or null when the id is null or unknown
     */
    public Violation violation(String id) {
        return id == null ? null : violations.get(id);
    }
}
