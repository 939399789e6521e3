package com.clapgrow.inbox.api.service;

/**
 * The caller asked for something invalid, e.g. a text message without content.
 * Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
