package com.actexport.core.markup;

import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the constrained inline markup of text blocks into styled runs.
 *
 * <p>Supported: bold ({@code b}, {@code strong}), italic ({@code i}, {@code em}),
 * underline ({@code u}), line breaks ({@code br} or a newline), paragraphs from block
 * elements. Every other tag is dropped while its text is kept. The conversion never
 * throws: if tokenizing fails, tags are stripped and the plain text is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InlineContent content = InlineMarkupParser.parse("<b>Итог</b>: нарушений<br>нет");
 * content.lines();      // [[Итог(bold), ": нарушений"], ["нет"]]
 * content.plainText();  // "Итог: нарушений\nнет"
 * }</pre>
 */
public final class InlineMarkupParser {

    private static final Logger log = LoggerFactory.getLogger(InlineMarkupParser.class);

    private InlineMarkupParser() {
    }

    /**
     * Parses inline markup.
     *
     * @param markup markup text, may be null
     * @return lines of styled runs, empty for null or blank input
     */
    public static InlineContent parse(String markup) {
        if (markup == null || markup.isBlank()) {
            return InlineContent.empty();
        }
        try {
            RunAccumulator accumulator = new RunAccumulator();
            MarkupTokenizer.tokenize(markup).forEach(accumulator::accept);
            return accumulator.result();
        } catch (RuntimeException e) {
            log.warn("Could not tokenize inline markup, falling back to plain text: {}", e.getMessage());
            return plainFallback(markup);
        }
    }

    static InlineContent plainFallback(String markup) {
        String stripped = markup
            .replaceAll("(?i)<br\\s*/?>", "\n")
            .replaceAll("<[^>]*>", "");
        RunAccumulator accumulator = new RunAccumulator();
        accumulator.accept(MarkupEvent.text(Parser.unescapeEntities(stripped, false)));
        return accumulator.result();
    }
}
