package com.ammann.conversion.enumeration;

import java.util.Locale;

/**
 * Reason a conversion job ended in {@link JobStatus#FAILED}.
 */
public enum FailureKind {
    /** Payload does not parse as the claimed source format */
    MALFORMED_INPUT,
    /** Valid input uses a construct the target format cannot represent */
    UNSUPPORTED_FEATURE,
    /** Unexpected failure inside a converter or the engine */
    INTERNAL_ERROR,
    /** Job exceeded the configured maximum duration */
    TIMEOUT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
