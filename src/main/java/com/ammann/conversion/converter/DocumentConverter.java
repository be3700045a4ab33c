package com.ammann.conversion.converter;

/**
 * Direct conversion between two formats.
 * <p>
 * Implementations are stateless and safe to call from many worker threads at once.
 */
@FunctionalInterface
public interface DocumentConverter {

    /**
     * Converts a payload of the source format into the target format.
     *
     * @param payload source document bytes (UTF-8 for textual formats)
     * @return converted document bytes
     * @throws ConversionException if the payload cannot be converted
     */
    byte[] convert(byte[] payload) throws ConversionException;
}
