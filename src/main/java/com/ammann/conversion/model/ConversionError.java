package com.ammann.conversion.model;

import com.ammann.conversion.enumeration.FailureKind;
import java.util.Objects;

/**
 * Failure recorded on a job that ended in FAILED.
 *
 * @param kind failure category
 * @param message human-readable summary
 */
public record ConversionError(FailureKind kind, String message) {

    public ConversionError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? kind.wireName() : message;
    }
}
