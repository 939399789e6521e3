package com.clapgrow.inbox.api.repository;

import com.clapgrow.inbox.api.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContactRepository extends JpaRepository<Contact, UUID> {

    Optional<Contact> findByOrganizationIdAndIdentifier(UUID organizationId, String identifier);

    /**
     * Inserts the contact unless one already exists for (organization, identifier).
     *
     * @return 1 if inserted, 0 if a concurrent writer already created it
     */
    @Modifying
    @Query(value = "INSERT INTO contacts (id, organization_id, identifier, display_name, is_deleted, created_at, updated_at) " +
                   "VALUES (:id, :organizationId, :identifier, :displayName, false, :now, :now) " +
                   "ON CONFLICT (organization_id, identifier) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("organizationId") UUID organizationId,
                       @Param("identifier") String identifier,
                       @Param("displayName") String displayName,
                       @Param("now") LocalDateTime now);
}
