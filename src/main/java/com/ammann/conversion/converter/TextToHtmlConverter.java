package com.ammann.conversion.converter;

import java.util.regex.Pattern;
import org.jsoup.nodes.Entities;

/**
 * Plain text to an HTML fragment.
 * <p>
 * Blank lines separate paragraphs; single line breaks inside a paragraph become {@code <br>}.
 */
public class TextToHtmlConverter implements DocumentConverter {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R[ \\t]*\\R+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String text = TextCodec.decode(payload, "text").strip();
        if (text.isEmpty()) {
            return new byte[0];
        }
        StringBuilder html = new StringBuilder();
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String[] lines = LINE_BREAK.split(paragraph.strip());
            html.append("<p>");
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    html.append("<br>\n");
                }
                html.append(Entities.escape(lines[i].strip()));
            }
            html.append("</p>\n");
        }
        return TextCodec.encode(html.toString());
    }
}
