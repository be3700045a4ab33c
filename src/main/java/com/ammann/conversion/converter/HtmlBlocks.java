package com.ammann.conversion.converter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Flattens an HTML document into a list of text blocks that the text, Markdown, PDF and
 * DOCX writers render in their own way.
 * <p>
 * Inline markup is either dropped ({@link Inline#PLAIN}) or rendered as Markdown
 * ({@link Inline#MARKDOWN}).
 */
final class HtmlBlocks {

    enum Inline {
        PLAIN,
        MARKDOWN
    }

    enum BlockType {
        HEADING,
        PARAGRAPH,
        LIST_ITEM,
        CODE,
        QUOTE,
        RULE
    }

    /**
     * @param type block kind
     * @param level heading level (1-6) or list nesting depth (0-based); 0 otherwise
     * @param ordinal position in an ordered list, 0 for unordered lists and other blocks
     * @param text block content; may contain line breaks
     */
    record TextBlock(BlockType type, int level, int ordinal, String text) {}

    private static final Set<String> IGNORED =
            Set.of("script", "style", "noscript", "template", "head", "iframe", "object");
    private static final Set<String> CONTAINERS =
            Set.of(
                    "html", "body", "div", "section", "article", "main", "header", "footer",
                    "nav", "aside", "figure", "form", "fieldset", "details", "center");

    private HtmlBlocks() {}

    static List<TextBlock> parse(String html, Inline inline) {
        Document document = Jsoup.parse(html);
        document.select(String.join(",", IGNORED)).remove();
        List<TextBlock> blocks = new ArrayList<>();
        new Walker(inline, blocks).container(document.body());
        return blocks;
    }

    /**
     * Joins blocks the way the text and Markdown writers both expect: consecutive list
     * items on adjacent lines, everything else separated by a blank line.
     */
    static String join(List<TextBlock> blocks, Function<TextBlock, String> render) {
        StringBuilder out = new StringBuilder();
        TextBlock previous = null;
        for (TextBlock block : blocks) {
            if (previous != null) {
                boolean listRun =
                        previous.type() == BlockType.LIST_ITEM && block.type() == BlockType.LIST_ITEM;
                out.append(listRun ? "\n" : "\n\n");
            }
            out.append(render.apply(block));
            previous = block;
        }
        return out.toString();
    }

    private static final class Walker {

        private final Inline inline;
        private final List<TextBlock> blocks;

        Walker(Inline inline, List<TextBlock> blocks) {
            this.inline = inline;
            this.blocks = blocks;
        }

        void container(Element element) {
            List<Node> pendingInline = new ArrayList<>();
            for (Node child : element.childNodes()) {
                if (child instanceof Element el && isBlock(el)) {
                    flushParagraph(pendingInline);
                    block(el);
                } else {
                    pendingInline.add(child);
                }
            }
            flushParagraph(pendingInline);
        }

        private void flushParagraph(List<Node> nodes) {
            if (nodes.isEmpty()) {
                return;
            }
            StringBuilder text = new StringBuilder();
            for (Node node : nodes) {
                appendInline(node, text);
            }
            nodes.clear();
            add(BlockType.PARAGRAPH, 0, 0, text.toString());
        }

        private void block(Element el) {
            String tag = el.normalName();
            switch (tag) {
                case "h1", "h2", "h3", "h4", "h5", "h6" ->
                        add(BlockType.HEADING, tag.charAt(1) - '0', 0, inlineText(el));
                case "p", "dt", "dd", "caption", "address" ->
                        add(BlockType.PARAGRAPH, 0, 0, inlineText(el));
                case "ul", "ol" -> list(el, 0);
                case "pre" -> addRaw(BlockType.CODE, el.wholeText());
                case "blockquote" -> add(BlockType.QUOTE, 0, 0, blockText(el));
                case "hr" -> blocks.add(new TextBlock(BlockType.RULE, 0, 0, ""));
                case "table" -> table(el);
                default -> container(el);
            }
        }

        private void list(Element listElement, int depth) {
            boolean ordered = listElement.normalName().equals("ol");
            int index = 0;
            for (Element item : listElement.children()) {
                if (!item.normalName().equals("li")) {
                    continue;
                }
                index++;
                StringBuilder text = new StringBuilder();
                List<Element> nested = new ArrayList<>();
                for (Node child : item.childNodes()) {
                    if (child instanceof Element el
                            && (el.normalName().equals("ul") || el.normalName().equals("ol"))) {
                        nested.add(el);
                    } else if (child instanceof Element el && el.normalName().equals("p")) {
                        appendSeparator(text);
                        appendInline(el, text);
                    } else {
                        appendInline(child, text);
                    }
                }
                add(BlockType.LIST_ITEM, depth, ordered ? index : 0, text.toString());
                for (Element sub : nested) {
                    list(sub, depth + 1);
                }
            }
        }

        private void table(Element table) {
            for (Element row : table.select("tr")) {
                List<String> cells = new ArrayList<>();
                for (Element cell : row.select("th, td")) {
                    cells.add(inlineText(cell).replace('\n', ' '));
                }
                add(BlockType.PARAGRAPH, 0, 0, String.join(" | ", cells));
            }
        }

        private String blockText(Element el) {
            List<TextBlock> nested = new ArrayList<>();
            new Walker(inline, nested).container(el);
            return join(nested, TextBlock::text);
        }

        private String inlineText(Element el) {
            StringBuilder text = new StringBuilder();
            for (Node child : el.childNodes()) {
                appendInline(child, text);
            }
            return text.toString();
        }

        private void appendInline(Node node, StringBuilder out) {
            if (node instanceof TextNode textNode) {
                out.append(collapse(textNode.getWholeText()));
                return;
            }
            if (!(node instanceof Element el)) {
                return;
            }
            boolean markdown = inline == Inline.MARKDOWN;
            switch (el.normalName()) {
                case "br" -> out.append('\n');
                case "strong", "b" -> wrap(el, out, markdown ? "**" : "");
                case "em", "i" -> wrap(el, out, markdown ? "*" : "");
                case "code", "kbd", "samp" -> wrap(el, out, markdown ? "`" : "");
                case "del", "s", "strike" -> wrap(el, out, markdown ? "~~" : "");
                case "a" -> {
                    String label = inlineText(el);
                    String href = el.attr("href");
                    if (markdown && !href.isBlank()) {
                        out.append('[').append(label).append("](").append(href).append(')');
                    } else {
                        out.append(label);
                    }
                }
                case "img" -> {
                    String alt = el.attr("alt");
                    if (markdown) {
                        out.append("![").append(alt).append("](").append(el.attr("src")).append(')');
                    } else {
                        out.append(alt);
                    }
                }
                default -> {
                    for (Node child : el.childNodes()) {
                        appendInline(child, out);
                    }
                }
            }
        }

        private void wrap(Element el, StringBuilder out, String marker) {
            String inner = inlineText(el);
            if (inner.isBlank()) {
                out.append(inner);
                return;
            }
            out.append(marker).append(inner.strip()).append(marker);
        }

        private void add(BlockType type, int level, int ordinal, String raw) {
            String text = tidy(raw);
            if (!text.isEmpty() || type == BlockType.LIST_ITEM) {
                blocks.add(new TextBlock(type, level, ordinal, text));
            }
        }

        private void addRaw(BlockType type, String raw) {
            String text = raw.replaceAll("^\\R+|\\s+$", "");
            if (!text.isEmpty()) {
                blocks.add(new TextBlock(type, 0, 0, text));
            }
        }

        private static void appendSeparator(StringBuilder text) {
            if (!text.isEmpty() && !text.toString().isBlank()) {
                text.append('\n');
            }
        }

        private static boolean isBlock(Element el) {
            String tag = el.normalName().toLowerCase(Locale.ROOT);
            return CONTAINERS.contains(tag)
                    || switch (tag) {
                        case "h1", "h2", "h3", "h4", "h5", "h6", "p", "ul", "ol", "dl", "dt", "dd",
                                "pre", "blockquote", "hr", "table", "caption", "address" -> true;
                        default -> false;
                    };
        }

        private static String collapse(String text) {
            return text.replaceAll("\\s+", " ");
        }

        /** Trims every line and drops the whitespace runs left by collapsed markup. */
        private static String tidy(String text) {
            StringBuilder out = new StringBuilder();
            for (String line : text.split("\n", -1)) {
                if (!out.isEmpty()) {
                    out.append('\n');
                }
                out.append(line.strip());
            }
            return out.toString().strip();
        }
    }
}
