package com.clapgrow.inbox.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * External party a conversation is held with, identified by whatever the platform
 * gives us: phone number, platform user id or email address.
 */
@Entity
@Table(name = "contacts", uniqueConstraints = {
    @UniqueConstraint(name = "uq_contacts_organization_identifier", columnNames = {"organization_id", "identifier"})
})
@Getter
@Setter
@NoArgsConstructor
public class Contact extends BaseAuditableEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "identifier", nullable = false, length = 255)
    private String identifier;

    @Column(name = "display_name", length = 255)
    private String displayName;
}
