package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.entity.WebhookEvent;
import com.clapgrow.inbox.api.enums.WebhookEventStatus;
import com.clapgrow.inbox.api.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Retries webhook events left PENDING by a transient failure, and recovers events
 * stranded PENDING before their first attempt finished.
 *
 * <p>Not transactional itself: each candidate is claimed with an atomic UPDATE and then
 * reprocessed through {@link WebhookIntakeService}, which commits every state change
 * separately. One failing event never rolls back another, and several instances can
 * run the scheduler side by side.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRetryService {

    private final WebhookEventRepository webhookEventRepository;
    private final WebhookIntakeService webhookIntakeService;
    private final InboxProperties properties;
    private final TransactionTemplate transactionTemplate;

    @Scheduled(fixedDelayString = "${inbox.webhook.retry-interval-ms:60000}",
               initialDelayString = "${inbox.webhook.retry-initial-delay-ms:30000}")
    public void retryPendingWebhooks() {
        InboxProperties.Webhook config = properties.getWebhook();
        int batchSize = Math.max(1, config.getRetryBatchSize());
        int totalRetried = 0;

        while (true) {
            LocalDateTime now = LocalDateTime.now();
            LocalDateTime threshold = now.minus(config.getRetryDelay());
            LocalDateTime stalledThreshold = now.minus(config.getStalledAfter());
            List<WebhookEvent> candidates = webhookEventRepository.findRetryCandidates(
                WebhookEventStatus.PENDING, config.getMaxRetries(), threshold, stalledThreshold,
                PageRequest.of(0, batchSize));

            if (candidates.isEmpty()) {
                break;
            }
            log.info("Found {} webhook event(s) eligible for retry", candidates.size());

            int claimedInBatch = 0;
            for (WebhookEvent candidate : candidates) {
                boolean stalled = candidate.getRetryCount() == 0;
                LocalDateTime claimThreshold = stalled ? stalledThreshold : threshold;
                Integer claimed = transactionTemplate.execute(status -> webhookEventRepository.claimForRetry(
                    candidate.getId(), candidate.getRetryCount(), claimThreshold, now));
                if (claimed == null || claimed == 0) {
                    log.debug("Webhook event {} already claimed by another instance", candidate.getId());
                    continue;
                }
                claimedInBatch++;
                if (stalled) {
                    log.warn("Recovering webhook event {} stranded PENDING since {}", candidate.getId(),
                        candidate.getUpdatedAt());
                }
                try {
                    webhookIntakeService.reprocess(candidate.getId());
                    totalRetried++;
                } catch (Exception e) {
                    log.error("Error retrying webhook event {}", candidate.getId(), e);
                }
            }

            // Claimed rows now have updated_at = now and drop out of the next query
            if (candidates.size() < batchSize || claimedInBatch == 0) {
                break;
            }
        }

        if (totalRetried > 0) {
            log.info("Completed webhook retry pass. Total retried: {}", totalRetried);
        } else {
            log.debug("No webhook events retried");
        }
    }
}
