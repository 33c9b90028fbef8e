package com.actexport.core.markup;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns inline markup into a flat stream of {@link MarkupEvent}s.
 *
 * <p>jsoup does the tokenizing, so entities are decoded and unbalanced tags are repaired
 * the way a browser would. Styles come from {@code b/strong}, {@code i/em},
 * {@code u/ins} and from {@code font-weight}, {@code font-style} and
 * {@code text-decoration} in a {@code style} attribute. Other tags produce no style
 * events but their text is kept; block elements produce paragraph breaks.
 */
final class MarkupTokenizer {

    private MarkupTokenizer() {
    }

    static List<MarkupEvent> tokenize(String markup) {
        Element body = Jsoup.parseBodyFragment(markup).body();
        List<MarkupEvent> events = new ArrayList<>();
        NodeTraversor.traverse(new EventVisitor(body, events), body);
        return events;
    }

    private static final class EventVisitor implements NodeVisitor {

        private final Element body;
        private final List<MarkupEvent> events;

        private EventVisitor(Element body, List<MarkupEvent> events) {
            this.body = body;
            this.events = events;
        }

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                String text = textNode.getWholeText().replace('\u00a0', ' ');
                if (text.isBlank() && text.indexOf('\n') >= 0) {
                    return;
                }
                events.add(MarkupEvent.text(text));
                return;
            }
            if (!(node instanceof Element element) || element == body) {
                return;
            }
            if ("br".equals(element.normalName())) {
                events.add(MarkupEvent.lineBreak());
                return;
            }
            if (element.isBlock()) {
                events.add(MarkupEvent.paragraphBreak());
            }
            Set<InlineStyle> styles = stylesOf(element);
            if (!styles.isEmpty()) {
                events.add(MarkupEvent.open(styles));
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element element) || element == body || "br".equals(element.normalName())) {
                return;
            }
            Set<InlineStyle> styles = stylesOf(element);
            if (!styles.isEmpty()) {
                events.add(MarkupEvent.close(styles));
            }
            if (element.isBlock()) {
                events.add(MarkupEvent.paragraphBreak());
            }
        }
    }

    static Set<InlineStyle> stylesOf(Element element) {
        Set<InlineStyle> styles = EnumSet.noneOf(InlineStyle.class);
        switch (element.normalName()) {
            case "b", "strong" -> styles.add(InlineStyle.BOLD);
            case "i", "em" -> styles.add(InlineStyle.ITALIC);
            case "u", "ins" -> styles.add(InlineStyle.UNDERLINE);
            default -> {
            }
        }
        String style = element.attr("style").toLowerCase(Locale.ROOT);
        if (!style.isEmpty()) {
            String weight = cssValue(style, "font-weight");
            if (weight.equals("bold") || weight.equals("bolder") || weight.matches("[6-9]00")) {
                styles.add(InlineStyle.BOLD);
            }
            if (cssValue(style, "font-style").equals("italic")) {
                styles.add(InlineStyle.ITALIC);
            }
            if (cssValue(style, "text-decoration").contains("underline")
                || cssValue(style, "text-decoration-line").contains("underline")) {
                styles.add(InlineStyle.UNDERLINE);
            }
        }
        return styles;
    }

    private static String cssValue(String style, String property) {
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon > 0 && declaration.substring(0, colon).trim().equals(property)) {
                return declaration.substring(colon + 1).trim();
            }
        }
        return "";
    }
}
