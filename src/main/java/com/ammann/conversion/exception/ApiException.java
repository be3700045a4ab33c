package com.ammann.conversion.exception;

/**
 * Base unchecked exception for failures reported to API clients.
 *
 * <p>Every instance carries the machine-readable error code and the HTTP status that
 * {@link GlobalExceptionHandler} writes into the error response. MCP tools report only the
 * message.
 */
public abstract class ApiException extends RuntimeException
{
    private final String errorCode;
    private final int httpStatus;

    protected ApiException(String errorCode, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    protected ApiException(String errorCode, int httpStatus, String message) {
        this(errorCode, httpStatus, message, null);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
