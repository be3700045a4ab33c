package com.ammann.conversion.converter;

import com.ammann.conversion.converter.HtmlBlocks.TextBlock;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

/**
 * HTML to PDF using Apache PDFBox.
 * <p>
 * Lays out the HTML blocks as wrapped lines on US Letter pages with the standard 14 fonts.
 * Those fonts only cover WinAnsi; text outside it fails with UNSUPPORTED_FEATURE.
 */
public class HtmlToPdfConverter implements DocumentConverter {

    private static final PDRectangle PAGE_SIZE = PDRectangle.LETTER;
    private static final float MARGIN = 56f;
    private static final float BODY_SIZE = 11f;
    private static final float LINE_FACTOR = 1.4f;

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        String html = TextCodec.decode(payload, "html");
        List<TextBlock> blocks = HtmlBlocks.parse(html, HtmlBlocks.Inline.PLAIN);

        try (PDDocument document = new PDDocument()) {
            try (PageWriter writer = new PageWriter(document)) {
                for (TextBlock block : blocks) {
                    writeBlock(writer, block);
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IllegalArgumentException e) {
            // PDFBox reports glyphs missing from the font encoding this way
            throw ConversionException.unsupported(
                    "Document contains characters the PDF base fonts cannot encode: " + e.getMessage());
        } catch (IOException e) {
            throw ConversionException.internal("Failed to render PDF document: " + e.getMessage(), e);
        }
    }

    private void writeBlock(PageWriter writer, TextBlock block) throws IOException {
        switch (block.type()) {
            case HEADING -> {
                float size = Math.max(BODY_SIZE + 1, 20f - 2f * (block.level() - 1));
                writer.paragraph(block.text(), PDType1Font.HELVETICA_BOLD, size, 0f);
            }
            case LIST_ITEM -> {
                String marker = block.ordinal() > 0 ? block.ordinal() + ". " : "- ";
                writer.paragraph(marker + block.text(), PDType1Font.HELVETICA, BODY_SIZE, 18f * (block.level() + 1));
            }
            case CODE -> writer.paragraph(block.text(), PDType1Font.COURIER, BODY_SIZE - 1, 12f);
            case QUOTE -> writer.paragraph(block.text(), PDType1Font.HELVETICA_OBLIQUE, BODY_SIZE, 24f);
            case RULE -> writer.skip(BODY_SIZE);
            case PARAGRAPH -> writer.paragraph(block.text(), PDType1Font.HELVETICA, BODY_SIZE, 0f);
        }
    }

    /**
     * Streams wrapped lines onto pages, starting a new page when the current one is full.
     */
    private static final class PageWriter implements AutoCloseable {

        private final PDDocument document;
        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void paragraph(String text, PDFont font, float size, float indent) throws IOException {
            float leading = size * LINE_FACTOR;
            float width = PAGE_SIZE.getWidth() - 2 * MARGIN - indent;
            for (String line : wrap(sanitize(text), font, size, width)) {
                if (y - leading < MARGIN) {
                    newPage();
                }
                y -= leading;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + indent, y);
                stream.showText(line);
                stream.endText();
            }
            skip(size * 0.6f);
        }

        void skip(float amount) {
            y -= amount;
        }

        private void newPage() throws IOException {
            if (stream != null) {
                stream.close();
            }
            PDPage page = new PDPage(PAGE_SIZE);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = PAGE_SIZE.getHeight() - MARGIN;
        }

        @Override
        public void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private static String sanitize(String text) {
            return text.replace("\t", "    ").replace('\u00A0', ' ').replaceAll("[\\p{Cntrl}&&[^\n]]", "");
        }

        private static List<String> wrap(String text, PDFont font, float size, float width)
                throws IOException {
            List<String> lines = new ArrayList<>();
            for (String source : text.split("\n", -1)) {
                StringBuilder line = new StringBuilder();
                for (String word : source.split(" ")) {
                    String candidate = line.isEmpty() ? word : line + " " + word;
                    if (!line.isEmpty() && textWidth(candidate, font, size) > width) {
                        lines.add(line.toString());
                        line = new StringBuilder(word);
                    } else {
                        line = new StringBuilder(candidate);
                    }
                }
                lines.add(line.toString());
            }
            return lines;
        }

        private static float textWidth(String text, PDFont font, float size) throws IOException {
            return font.getStringWidth(text) / 1000f * size;
        }
    }
}
