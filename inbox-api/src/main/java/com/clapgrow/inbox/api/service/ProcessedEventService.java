package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.repository.ProcessedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Consumer-side deduplication for at-least-once delivery.
 *
 * <p>An event is marked only after its side effects committed. A crash in between
 * means the event is handled again, which every consumer tolerates because the
 * underlying operations are idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcessedEventService {

    private final ProcessedEventRepository processedEventRepository;
    private final TransactionTemplate transactionTemplate;

    public boolean isProcessed(UUID eventId, String consumer) {
        return processedEventRepository.existsByEventIdAndConsumer(eventId, consumer);
    }

    /**
     * @return true if this call recorded the event, false if it was already recorded
     */
    public boolean markProcessed(UUID eventId, String consumer) {
        Integer inserted = transactionTemplate.execute(status ->
            processedEventRepository.markProcessed(eventId, consumer, LocalDateTime.now()));
        boolean recorded = inserted != null && inserted > 0;
        if (!recorded) {
            log.debug("Event {} was already recorded for consumer {}", eventId, consumer);
        }
        return recorded;
    }
}
