package com.ammann.conversion.enumeration;

import java.util.Locale;

/**
 * Why a conversion request was refused before any job was created.
 */
public enum RejectionReason {
    UNSUPPORTED_CONVERSION,
    PAYLOAD_TOO_LARGE,
    INVALID_FORMAT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
