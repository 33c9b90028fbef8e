package com.actexport.core.model;

/**
 * Additional content entry of a violation.
 *
 * @param id entry id, may be null
 * @param type entry kind
 * @param content text of case and free text entries
 * @param url image location (images only)
 * @param caption image caption (images only)
 * @param filename image file name (images only)
 * @param order sort key; entries render in ascending order
 */
public record ContentItem(
    String id,
    ContentItemType type,
    String content,
    String url,
    String caption,
    String filename,
    int order
) {
    /**
     * Compact constructor normalizing nulls.
     */
    public ContentItem {
        if (type == null) {
            type = ContentItemType.FREE_TEXT;
        }
        content = content == null ? "" : content;
        url = url == null ? "" : url;
        caption = caption == null ? "" : caption;
        filename = filename == null ? "" : filename;
    }

    public static ContentItem caseItem(String content, int order) {
        return new ContentItem(null, ContentItemType.CASE, content, null, null, null, order);
    }

    public static ContentItem image(String filename, String caption, int order) {
        return new ContentItem(null, ContentItemType.IMAGE, null, null, caption, filename, order);
    }

    public static ContentItem freeText(String content, int order) {
        return new ContentItem(null, ContentItemType.FREE_TEXT, content, null, null, null, order);
    }
}
