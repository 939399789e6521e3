package com.clapgrow.inbox.api.normalizer;

/**
 * The webhook envelope is structurally invalid. Retrying the same payload cannot succeed.
 */
public class PayloadValidationException extends RuntimeException {

    public PayloadValidationException(String message) {
        super(message);
    }
}
