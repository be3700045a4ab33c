package com.ammann.conversion.converter;

import com.ammann.conversion.converter.HtmlBlocks.TextBlock;
import java.util.List;

/**
 * HTML to plain text using JSoup.
 * <p>
 * Markup is dropped; block structure survives as blank-line separated paragraphs.
 */
public class HtmlToTextConverter implements DocumentConverter {

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String html = TextCodec.decode(payload, "html");
        List<TextBlock> blocks = HtmlBlocks.parse(html, HtmlBlocks.Inline.PLAIN);
        return TextCodec.encode(HtmlBlocks.join(blocks, HtmlToTextConverter::render));
    }

    private static String render(TextBlock block) {
        return switch (block.type()) {
            case LIST_ITEM -> "  ".repeat(block.level())
                    + (block.ordinal() > 0 ? block.ordinal() + ". " : "- ")
                    + block.text();
            case RULE -> "----";
            default -> block.text();
        };
    }
}
