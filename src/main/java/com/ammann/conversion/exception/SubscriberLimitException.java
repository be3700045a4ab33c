package com.ammann.conversion.exception;

/**
 * The event broadcaster already serves the maximum number of subscribers.
 *
 * <p>Reported as HTTP 503 so clients retry later.
 */
public class SubscriberLimitException extends ApiException {

    public SubscriberLimitException(int limit) {
        super("SUBSCRIBER_LIMIT", 503, String.format("Event stream subscriber limit of %d reached", limit));
    }
}
