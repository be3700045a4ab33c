package com.ammann.conversion.converter;

import com.ammann.conversion.enumeration.FailureKind;

/**
 * Exception thrown when a converter cannot produce the target document.
 */
public class ConversionException extends Exception {

    private final FailureKind kind;

    public ConversionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConversionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static ConversionException malformed(String message, Throwable cause) {
        return new ConversionException(FailureKind.MALFORMED_INPUT, message, cause);
    }

    public static ConversionException unsupported(String message) {
        return new ConversionException(FailureKind.UNSUPPORTED_FEATURE, message);
    }

    public static ConversionException internal(String message, Throwable cause) {
        return new ConversionException(FailureKind.INTERNAL_ERROR, message, cause);
    }
}
