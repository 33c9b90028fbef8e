package com.actexport.core.tree;

/**
 * Controls how much of a located node is kept by {@link ActTree#extractSubtree}.
 *
 * @param recursive false keeps the node alone with its children cleared
 * @param maxDepth deepest level kept below the node when recursive; null means unlimited
 */
public record SubtreeOptions(
    boolean recursive,
    Integer maxDepth
) {
    /**
     * Compact constructor with validation.
     */
    public SubtreeOptions {
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    /**
     * Keeps the whole subtree.
     *
     * @return recursive options without depth limit
     */
    public static SubtreeOptions full() {
        return new SubtreeOptions(true, null);
    }

    /**
     * Keeps only the located node.
     *
     * @return non-recursive options
     */
    public static SubtreeOptions nodeOnly() {
        return new SubtreeOptions(false, null);
    }

    /**
     * Keeps the subtree down to the given depth below the located node.
     *
     * @param maxDepth 1 keeps direct children only
     * @return recursive options with a depth limit
     */
    public static SubtreeOptions limitedTo(int maxDepth) {
        return new SubtreeOptions(true, maxDepth);
    }
}
