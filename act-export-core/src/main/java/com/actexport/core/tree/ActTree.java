package com.actexport.core.tree;

import com.actexport.core.model.ActNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only operations over the act tree.
 *
 * <p>All walks are depth-first and pre-order, so "first" always means first in display
 * order. Numbers are only ever taken from {@link com.actexport.core.model.NodeType#ITEM}
 * nodes; table, text block and violation nodes obtain a display number from their
 * nearest enclosing item.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Optional<String> number = ActTree.findNearestAncestorItemNumber(tree, "table-node-7");
 * Optional<ActNode> section = ActTree.extractSubtree(tree, "5.1", SubtreeOptions.limitedTo(1));
 * }</pre>
 */
public final class ActTree {

    private static final Logger log = LoggerFactory.getLogger(ActTree.class);

    private ActTree() {
    }

    /**
     * Maps every numbered item node id to its number.
     *
     * @param tree root node
     * @return node id to number, in pre-order
     */
    public static Map<String, String> buildItemNumberIndex(ActNode tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Map<String, String> index = new LinkedHashMap<>();
        indexNumbers(tree, index);
        return index;
    }

    private static void indexNumbers(ActNode node, Map<String, String> index) {
        if (node.isItem() && node.hasNumber()) {
            index.putIfAbsent(node.id(), node.number());
        }
        for (ActNode child : node.children()) {
            indexNumbers(child, index);
        }
    }

    /**
     * Collects all item numbers present in the tree.
     *
     * @param tree root node
     * @return item numbers in pre-order
     */
    public static Set<String> collectAllItemNumbers(ActNode tree) {
        return new LinkedHashSet<>(buildItemNumberIndex(tree).values());
    }

    /**
     * Finds the number of the closest enclosing item of a node.
     *
     * <p>For a numbered item the item's own number is returned. Any number of non-item
     * wrappers between the node and the item are skipped.
     *
     * @param tree root node
     * @param targetNodeId id of the node to resolve
     * @return nearest item number, or empty if the id is absent or no item above it is numbered
     */
    public static Optional<String> findNearestAncestorItemNumber(ActNode tree, String targetNodeId) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (targetNodeId == null) {
            return Optional.empty();
        }
        return searchAncestorNumber(tree, targetNodeId, null);
    }

    private static Optional<String> searchAncestorNumber(ActNode node, String targetId, String carried) {
        String current = node.isItem() && node.hasNumber() ? node.number() : carried;
        if (node.id().equals(targetId)) {
            return Optional.ofNullable(current);
        }
        for (ActNode child : node.children()) {
            Optional<String> found = searchAncestorNumber(child, targetId, current);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first node in pre-order whose normalized number equals the query.
     *
     * @param tree root node
     * @param number number to look up, trailing separators are ignored
     * @return matching node, or empty if none
     */
    public static Optional<ActNode> findByNumber(ActNode tree, String number) {
        Objects.requireNonNull(tree, "tree must not be null");
        String wanted = normalizeNumber(number);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        return searchNumber(tree, wanted);
    }

    private static Optional<ActNode> searchNumber(ActNode node, String wanted) {
        if (node.hasNumber() && normalizeNumber(node.number()).equals(wanted)) {
            return Optional.of(node);
        }
        for (ActNode child : node.children()) {
            Optional<ActNode> found = searchNumber(child, wanted);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Locates a node by number and returns a pruned copy of it.
     *
     * <p>Non-recursive extraction returns the node with its children cleared. Recursive
     * extraction keeps descendants down to {@code maxDepth} levels below the node.
     * Duplicate numbers resolve to the first match in pre-order.
     *
     * @param tree root node
     * @param number number to look up
     * @param options pruning options
     * @return pruned copy of the node, or empty if the number is not present
     */
    public static Optional<ActNode> extractSubtree(ActNode tree, String number, SubtreeOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Optional<ActNode> found = findByNumber(tree, number);
        if (found.isEmpty()) {
            log.debug("No node numbered '{}' in tree", number);
            return Optional.empty();
        }
        ActNode node = found.get();
        if (!options.recursive()) {
            return Optional.of(node.withChildren(List.of()));
        }
        return Optional.of(prune(node, 0, options.maxDepth()));
    }

    private static ActNode prune(ActNode node, int depth, Integer maxDepth) {
        if (maxDepth != null && depth >= maxDepth) {
            return node.withChildren(List.of());
        }
        List<ActNode> kept = new ArrayList<>(node.children().size());
        for (ActNode child : node.children()) {
            kept.add(prune(child, depth + 1, maxDepth));
        }
        return node.withChildren(kept);
    }

    /**
     * Returns numbers carried by more than one item, each reported once.
     *
     * @param tree root node
     * @return duplicated numbers in order of their second occurrence
     */
    public static List<String> findDuplicateNumbers(ActNode tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        collectDuplicates(tree, seen, duplicates);
        return List.copyOf(duplicates);
    }

    private static void collectDuplicates(ActNode node, Set<String> seen, Set<String> duplicates) {
        if (node.isItem() && node.hasNumber() && !seen.add(normalizeNumber(node.number()))) {
            duplicates.add(normalizeNumber(node.number()));
        }
        for (ActNode child : node.children()) {
            collectDuplicates(child, seen, duplicates);
        }
    }

    /**
     * Normalizes a hierarchical number for comparison: trims whitespace and trailing dots.
     *
     * @param number raw number, may be null
     * @return normalized number, empty for null
     */
    public static String normalizeNumber(String number) {
        if (number == null) {
            return "";
        }
        String trimmed = number.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '.') {
            end--;
        }
        return trimmed.substring(0, end);
    }
}
