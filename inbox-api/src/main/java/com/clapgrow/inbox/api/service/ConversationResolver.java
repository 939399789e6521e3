package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.enums.ConversationPriority;
import com.clapgrow.inbox.api.enums.ConversationStatus;
import com.clapgrow.inbox.api.repository.ConversationRepository;
import com.clapgrow.inbox.common.enums.Medium;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds or creates the single active conversation for an
 * (organization, user, contact, medium) tuple.
 *
 * <p>Concurrent webhook deliveries for a brand-new contact race to create the
 * conversation. The partial unique index on the active tuple decides the winner; the
 * conditional insert turns the loser's insert into a no-op, and the loser returns the
 * winner's row. Callers never see the race.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationResolver {

    private final ConversationRepository conversationRepository;
    private final TransactionTemplate transactionTemplate;

    public Conversation resolve(UUID organizationId, UUID userId, UUID contactId, Medium medium) {
        Optional<Conversation> existing = conversationRepository.findActive(
            organizationId, userId, contactId, medium.getCode());
        if (existing.isPresent()) {
            return existing.get();
        }

        UUID candidateId = UUID.randomUUID();
        try {
            Conversation created = transactionTemplate.execute(status -> {
                LocalDateTime now = LocalDateTime.now();
                int inserted = conversationRepository.insertActiveIfAbsent(
                    candidateId, organizationId, userId, contactId, medium.getCode(), now);
                if (inserted == 0) {
                    return null;
                }
                int deactivated = conversationRepository.deactivateOthers(
                    organizationId, userId, contactId, medium.getCode(), candidateId, now);
                if (deactivated > 0) {
                    log.warn("Deactivated {} stale active conversation(s) for contact {} on {}",
                        deactivated, contactId, medium);
                }
                return conversationRepository.findById(candidateId).orElse(null);
            });
            if (created != null) {
                log.info("Created conversation {} for contact {} on {} (organization {})",
                    created.getId(), contactId, medium, organizationId);
                return created;
            }
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent conversation insert for contact {} on {}; using existing conversation", contactId, medium);
        }

        return conversationRepository.findActive(organizationId, userId, contactId, medium.getCode())
            .orElseThrow(() -> new IllegalStateException("Active conversation for contact " + contactId
                + " on " + medium + " disappeared during resolution"));
    }

    /**
     * Clears the active flag so the next inbound message starts a new conversation.
     *
     * @return true if the conversation was active
     */
    public boolean deactivate(UUID conversationId) {
        Integer updated = transactionTemplate.execute(status -> {
            if (!conversationRepository.existsById(conversationId)) {
                throw ResourceNotFoundException.of("Conversation", conversationId);
            }
            return conversationRepository.deactivate(conversationId, LocalDateTime.now());
        });
        boolean changed = updated != null && updated > 0;
        if (changed) {
            log.info("Deactivated conversation {}", conversationId);
        }
        return changed;
    }

    public Conversation updateStatus(UUID conversationId, ConversationStatus status) {
        return transactionTemplate.execute(tx -> {
            Conversation conversation = load(conversationId);
            if (conversation.getStatus() != status) {
                log.info("Conversation {} status {} -> {}", conversationId, conversation.getStatus(), status);
                conversation.setStatus(status);
            }
            return conversationRepository.save(conversation);
        });
    }

    public Conversation updatePriority(UUID conversationId, ConversationPriority priority) {
        return transactionTemplate.execute(tx -> {
            Conversation conversation = load(conversationId);
            if (conversation.getPriority() != priority) {
                log.info("Conversation {} priority {} -> {}", conversationId, conversation.getPriority(), priority);
                conversation.setPriority(priority);
            }
            return conversationRepository.save(conversation);
        });
    }

    private Conversation load(UUID conversationId) {
        return conversationRepository.findById(conversationId)
            .orElseThrow(() -> ResourceNotFoundException.of("Conversation", conversationId));
    }
}
