package com.ammann.conversion.converter;

import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * PDF to plain text using Apache PDFBox.
 */
public class PdfToTextConverter implements DocumentConverter {

    @Override
    public byte[] convert(byte[] payload) throws ConversionException {
        try (PDDocument document = PDDocument.load(payload)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            return TextCodec.encode(stripper.getText(document).strip());
        } catch (InvalidPasswordException e) {
            throw ConversionException.unsupported("Encrypted PDF documents are not supported");
        } catch (IOException e) {
            throw ConversionException.malformed("Failed to read PDF document: " + e.getMessage(), e);
        }
    }
}
