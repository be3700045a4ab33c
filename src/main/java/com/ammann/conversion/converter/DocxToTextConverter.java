package com.ammann.conversion.converter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * DOCX to plain text using Apache POI.
 * <p>
 * Paragraphs are separated by a blank line; table rows become one line with cells joined by " | ".
 */
public class DocxToTextConverter implements DocumentConverter {

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(payload))) {
            List<String> blocks = new ArrayList<>();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    String text = paragraph.getText().strip();
                    if (!text.isEmpty()) {
                        blocks.add(text);
                    }
                } else if (element instanceof XWPFTable table) {
                    blocks.add(tableText(table));
                }
            }
            return TextCodec.encode(String.join("\n\n", blocks));
        } catch (IOException | POIXMLException | IllegalArgumentException e) {
            // POI signals non-OOXML and empty input with IllegalArgumentException subclasses
            throw ConversionException.malformed("Failed to read DOCX document: " + e.getMessage(), e);
        }
    }

    private static String tableText(XWPFTable table) {
        List<String> rows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                cells.add(cell.getText().strip());
            }
            rows.add(String.join(" | ", cells));
        }
        return String.join("\n", rows);
    }
}
