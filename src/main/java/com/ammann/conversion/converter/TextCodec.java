package com.ammann.conversion.converter;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding for textual payloads.
 */
final class TextCodec {

    private TextCodec() {}

    /**
     * Decodes {@code payload} as UTF-8, stripping a leading byte order mark.
     *
     * @throws ConversionException MALFORMED_INPUT on invalid byte sequences
     */
    static String decode(byte[] payload, String formatName) throws ConversionException {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
            return text.startsWith("\uFEFF") ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw ConversionException.malformed(formatName + " payload is not valid UTF-8", e);
        }
    }

    static byte[] encode(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
