package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Picks the organization user that owns conversations started by inbound messages.
 */
@Component
@RequiredArgsConstructor
public class SystemUserResolver {

    private final InboxProperties properties;

    /**
     * @throws IllegalStateException if neither a per-organization nor a default system user is configured
     */
    public UUID resolve(UUID organizationId) {
        InboxProperties.Pipeline pipeline = properties.getPipeline();
        UUID override = pipeline.getOrganizationSystemUsers().get(organizationId);
        if (override != null) {
            return override;
        }
        if (pipeline.getSystemUserId() == null) {
            throw new IllegalStateException("No system user configured for organization " + organizationId
                + "; set inbox.pipeline.system-user-id");
        }
        return pipeline.getSystemUserId();
    }
}
