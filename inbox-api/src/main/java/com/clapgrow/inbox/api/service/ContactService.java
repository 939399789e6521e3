package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.entity.Contact;
import com.clapgrow.inbox.api.repository.ContactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Maps platform origin identifiers (phone numbers, platform user ids, email
 * addresses) to contacts, creating them on first contact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactService {

    private final ContactRepository contactRepository;
    private final TransactionTemplate transactionTemplate;

    /**
     * Returns the contact for (organization, identifier), inserting it if absent.
     * Concurrent first messages from the same sender converge on one row.
     */
    public Contact getOrCreate(UUID organizationId, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new BadRequestException("Contact identifier is required");
        }
        String normalized = identifier.trim();

        return contactRepository.findByOrganizationIdAndIdentifier(organizationId, normalized)
            .orElseGet(() -> {
                Integer inserted = transactionTemplate.execute(status -> contactRepository.insertIfAbsent(
                    UUID.randomUUID(), organizationId, normalized, normalized, LocalDateTime.now()));
                if (inserted != null && inserted > 0) {
                    log.info("Created contact {} for organization {}", normalized, organizationId);
                }
                return contactRepository.findByOrganizationIdAndIdentifier(organizationId, normalized)
                    .orElseThrow(() -> new IllegalStateException(
                        "Contact " + normalized + " missing after insert for organization " + organizationId));
            });
    }
}
