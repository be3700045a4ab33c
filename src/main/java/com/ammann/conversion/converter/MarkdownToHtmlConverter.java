package com.ammann.conversion.converter;

import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

/**
 * CommonMark Markdown to an HTML fragment.
 * <p>
 * Markdown has no invalid documents, so this converter only fails on undecodable bytes.
 */
public class MarkdownToHtmlConverter implements DocumentConverter {

    private final Parser parser = Parser.builder().build();
    private final HtmlRenderer renderer = HtmlRenderer.builder().build();

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String markdown = TextCodec.decode(payload, "markdown");
        Node document = parser.parse(markdown);
        return TextCodec.encode(renderer.render(document));
    }
}
