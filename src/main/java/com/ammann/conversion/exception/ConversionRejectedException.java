package com.ammann.conversion.exception;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.RejectionReason;

/**
 * A conversion request refused before any job was created.
 *
 * <p>The {@link RejectionReason} doubles as the error code reported to clients. No job exists and no event
 * was published when this is thrown.
 */
public class ConversionRejectedException extends ApiException {

    private final RejectionReason reason;

    /** HTTP 422, absent from {@code Response.Status}. */
    static final int UNPROCESSABLE_ENTITY = 422;

    public ConversionRejectedException(RejectionReason reason, String message) {
        super(reason.name(), statusOf(reason), message);
        this.reason = reason;
    }

    private static int statusOf(RejectionReason reason) {
        return switch (reason) {
            case INVALID_FORMAT -> 400;
            case PAYLOAD_TOO_LARGE -> 413;
            case UNSUPPORTED_CONVERSION -> UNPROCESSABLE_ENTITY;
        };
    }

    public RejectionReason getReason() {
        return reason;
    }

    public static ConversionRejectedException invalidFormat(String name) {
        return new ConversionRejectedException(
                RejectionReason.INVALID_FORMAT, String.format("Unknown document format '%s'", name));
    }

    public static ConversionRejectedException payloadTooLarge(long size, long max) {
        return new ConversionRejectedException(
                RejectionReason.PAYLOAD_TOO_LARGE,
                String.format("Payload of %d bytes exceeds the maximum of %d bytes", size, max));
    }

    public static ConversionRejectedException unsupportedConversion(Format source, Format target) {
        return new ConversionRejectedException(
                RejectionReason.UNSUPPORTED_CONVERSION,
                String.format(
                        "No conversion path from %s to %s", source.wireName(), target.wireName()));
    }
}
