package com.clapgrow.inbox.api.service;

import java.util.UUID;

/**
 * A referenced message or conversation does not exist (or belongs to another organization).
 * Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException of(String resource, UUID id) {
        return new ResourceNotFoundException(resource + " not found: " + id);
    }
}
