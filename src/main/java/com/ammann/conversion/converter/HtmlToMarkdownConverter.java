package com.ammann.conversion.converter;

import com.ammann.conversion.converter.HtmlBlocks.TextBlock;
import java.util.List;

/**
 * HTML to Markdown using JSoup.
 * <p>
 * Covers headings, paragraphs, emphasis, inline code, links, images, lists, code blocks,
 * block quotes and rules. Other markup is reduced to its text.
 */
public class HtmlToMarkdownConverter implements DocumentConverter {

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String html = TextCodec.decode(payload, "html");
        List<TextBlock> blocks = HtmlBlocks.parse(html, HtmlBlocks.Inline.MARKDOWN);
        return TextCodec.encode(HtmlBlocks.join(blocks, HtmlToMarkdownConverter::render));
    }

    private static String render(TextBlock block) {
        return switch (block.type()) {
            case HEADING -> "#".repeat(block.level()) + " " + block.text().replace('\n', ' ');
            case LIST_ITEM -> "  ".repeat(block.level())
                    + (block.ordinal() > 0 ? block.ordinal() + ". " : "- ")
                    + block.text().replace("\n", "\n" + "  ".repeat(block.level() + 1));
            case CODE -> "```\n" + block.text() + "\n```";
            case QUOTE -> "> " + block.text().replace("\n", "\n> ");
            case RULE -> "---";
            case PARAGRAPH -> block.text().replace("\n", "  \n");
        };
    }
}
