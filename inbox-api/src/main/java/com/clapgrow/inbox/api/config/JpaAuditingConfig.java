package com.clapgrow.inbox.api.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Fills {@code created_at}/{@code updated_at} on entities. Kept off the application
 * class so web slice tests start without a JPA metamodel.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
