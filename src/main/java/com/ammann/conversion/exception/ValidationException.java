package com.ammann.conversion.exception;

/**
 * A request that is malformed before any format or size check applies: missing or
 * conflicting document content, bad Base64, blank parameters.
 */
public class ValidationException extends ApiException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(CODE, 400, message, cause);
    }

    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    public static ValidationException missingDocument(String... fields) {
        return new ValidationException("Missing document: " + String.join(" or ", quoted(fields)) + " is required");
    }

    public static ValidationException conflictingDocuments(String first, String second) {
        return new ValidationException(
                String.format("Specify either '%s' or '%s', not both", first, second));
    }

    public static ValidationException invalidBase64(String field, IllegalArgumentException cause) {
        return new ValidationException(String.format("'%s' is not valid Base64", field), cause);
    }

    private static String[] quoted(String[] fields) {
        String[] out = new String[fields.length];
        for (int i = 0; i < fields.length; i++) {
            out[i] = "'" + fields[i] + "'";
        }
        return out;
    }
}
