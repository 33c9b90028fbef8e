package com.actexport.core.tree;

import com.actexport.core.model.ActNode;
import com.actexport.core.model.NodeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain skeleton of an act: item headings indented by depth, optionally with bracketed
 * markers for tables, text blocks and violations and a statistics footer.
 */
public final class TreeOutline {

    private static final String INDENT = "  ";

    private TreeOutline() {
    }

    /**
     * Renders the outline of a tree. The root itself is not listed.
     *
     * @param tree root node
     * @param withElements whether to list non-item nodes and append statistics
     * @return outline text, lines separated by {@code \n}
     */
    public static String render(ActNode tree, boolean withElements) {
        Objects.requireNonNull(tree, "tree must not be null");
        List<String> lines = new ArrayList<>();
        Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
        for (ActNode child : tree.children()) {
            collect(child, 0, withElements, lines, counts);
        }
        if (withElements) {
            lines.add("");
            lines.add("Всего таблиц: " + counts.getOrDefault(NodeType.TABLE, 0));
            lines.add("Всего текстовых блоков: " + counts.getOrDefault(NodeType.TEXTBLOCK, 0));
            lines.add("Всего нарушений: " + counts.getOrDefault(NodeType.VIOLATION, 0));
        }
        return String.join("\n", lines);
    }

    private static void collect(ActNode node, int level, boolean withElements,
                                List<String> lines, Map<NodeType, Integer> counts) {
        String indent = INDENT.repeat(level);
        if (!node.isItem()) {
            counts.merge(node.type(), 1, Integer::sum);
            if (withElements) {
                lines.add(indent + "[" + elementName(node) + "]");
            }
            return;
        }
        String heading = ItemHeadings.text(node);
        if (!heading.isEmpty()) {
            lines.add(indent + heading);
        }
        for (ActNode child : node.children()) {
            collect(child, level + 1, withElements, lines, counts);
        }
    }

    private static String elementName(ActNode node) {
        if (node.customLabel() != null && !node.customLabel().isBlank()) {
            return node.customLabel();
        }
        return switch (node.type()) {
            case TABLE -> "Таблица";
            case TEXTBLOCK -> "Текстовый блок";
            case VIOLATION -> "Нарушение";
            case ITEM -> "Пункт";
        };
    }
}
