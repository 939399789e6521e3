package com.clapgrow.inbox.api.event;

/**
 * An event could not be handed to the broker in time. Transient from the caller's point of view.
 */
public class EventPublishException extends RuntimeException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
