package com.actexport.core.util;

import com.actexport.core.model.Alignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width text layout helpers for the plain text target.
 */
public final class TextWrap {

    private TextWrap() {
    }

    /**
     * Greedy word wrap. Explicit newlines are kept; words longer than the width are split.
     *
     * @param text text to wrap, may be null
     * @param width maximum line length, at least 1
     * @return wrapped lines; an empty input yields no lines
     */
    public static List<String> wrap(String text, int width) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        int limit = Math.max(1, width);
        for (String paragraph : text.split("\n", -1)) {
            wrapParagraph(paragraph, limit, result);
        }
        return result;
    }

    private static void wrapParagraph(String paragraph, int width, List<String> result) {
        String[] words = paragraph.trim().split("\\s+");
        if (words.length == 1 && words[0].isEmpty()) {
            result.add("");
            return;
        }
        StringBuilder line = new StringBuilder();
        for (String word : words) {
            while (word.length() > width) {
                if (line.length() > 0) {
                    result.add(line.toString());
                    line.setLength(0);
                }
                result.add(word.substring(0, width));
                word = word.substring(width);
            }
            if (word.isEmpty()) {
                continue;
            }
            if (line.length() == 0) {
                line.append(word);
            } else if (line.length() + 1 + word.length() <= width) {
                line.append(' ').append(word);
            } else {
                result.add(line.toString());
                line.setLength(0);
                line.append(word);
            }
        }
        if (line.length() > 0) {
            result.add(line.toString());
        }
    }

    /**
     * Positions a line within the width. Left and justified lines are returned as they are;
     * lines at least as long as the width are never padded.
     *
     * @param line line text
     * @param width available width
     * @param alignment alignment
     * @return line with leading padding
     */
    public static String align(String line, int width, Alignment alignment) {
        int free = width - line.length();
        if (free <= 0) {
            return line;
        }
        return switch (alignment) {
            case CENTER -> " ".repeat(free / 2) + line;
            case RIGHT -> " ".repeat(free) + line;
            case LEFT, JUSTIFY -> line;
        };
    }

    /**
     * Pads a value on the right to the given width.
     *
     * @param value text
     * @param width target width
     * @return padded text
     */
    public static String padRight(String value, int width) {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }
}
