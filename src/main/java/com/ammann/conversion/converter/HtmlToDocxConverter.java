package com.ammann.conversion.converter;

import com.ammann.conversion.converter.HtmlBlocks.TextBlock;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

/**
 * HTML to DOCX using Apache POI.
 * <p>
 * Each HTML block becomes one Word paragraph. Headings are bold and sized by level,
 * list items are indented with their marker, code blocks use a monospace font.
 */
public class HtmlToDocxConverter implements DocumentConverter {

    private static final String MONOSPACE = "Courier New";
    private static final int INDENT_TWIPS = 360;

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String html = TextCodec.decode(payload, "html");
        List<TextBlock> blocks = HtmlBlocks.parse(html, HtmlBlocks.Inline.PLAIN);

        try (XWPFDocument document = new XWPFDocument()) {
            for (TextBlock block : blocks) {
                writeBlock(document, block);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw ConversionException.internal("Failed to write DOCX document: " + e.getMessage(), e);
        }
    }

    private void writeBlock(XWPFDocument document, TextBlock block) {
        XWPFParagraph paragraph = document.createParagraph();
        XWPFRun run = paragraph.createRun();
        switch (block.type()) {
            case HEADING -> {
                run.setBold(true);
                run.setFontSize(Math.max(12, 20 - 2 * (block.level() - 1)));
                setText(run, block.text());
            }
            case LIST_ITEM -> {
                paragraph.setIndentationLeft(INDENT_TWIPS * (block.level() + 1));
                String marker = block.ordinal() > 0 ? block.ordinal() + ". " : "\u2022 ";
                setText(run, marker + block.text());
            }
            case CODE -> {
                run.setFontFamily(MONOSPACE);
                setText(run, block.text());
            }
            case QUOTE -> {
                paragraph.setIndentationLeft(INDENT_TWIPS * 2);
                run.setItalic(true);
                setText(run, block.text());
            }
            case RULE -> setText(run, "\u2015".repeat(20));
            case PARAGRAPH -> setText(run, block.text());
        }
    }

    /** Writes multi-line text as one run with explicit line breaks. */
    private static void setText(XWPFRun run, String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i], i);
        }
    }
}
