package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SystemUserResolverTest {

    @Test
    void testResolve_PrefersOrganizationOverride() {
        UUID defaultUser = UUID.randomUUID();
        UUID orgUser = UUID.randomUUID();
        UUID organizationId = UUID.randomUUID();
        InboxProperties properties = new InboxProperties();
        properties.getPipeline().setSystemUserId(defaultUser);
        properties.getPipeline().getOrganizationSystemUsers().put(organizationId, orgUser);
        SystemUserResolver resolver = new SystemUserResolver(properties);

        assertEquals(orgUser, resolver.resolve(organizationId));
        assertEquals(defaultUser, resolver.resolve(UUID.randomUUID()));
    }

    @Test
    void testResolve_WhenNothingConfigured_Throws() {
        SystemUserResolver resolver = new SystemUserResolver(new InboxProperties());

        assertThrows(IllegalStateException.class, () -> resolver.resolve(UUID.randomUUID()));
    }
}
