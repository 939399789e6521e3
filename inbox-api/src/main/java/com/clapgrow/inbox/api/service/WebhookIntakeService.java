package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.config.NormalizerExecutorConfig;
import com.clapgrow.inbox.api.entity.WebhookEvent;
import com.clapgrow.inbox.api.enums.WebhookEventStatus;
import com.clapgrow.inbox.api.event.EventPublisher;
import com.clapgrow.inbox.api.normalizer.NormalizationTimeoutException;
import com.clapgrow.inbox.api.normalizer.NormalizerRegistry;
import com.clapgrow.inbox.api.normalizer.PayloadValidationException;
import com.clapgrow.inbox.api.normalizer.PlatformNormalizer;
import com.clapgrow.inbox.api.normalizer.UnsupportedPlatformException;
import com.clapgrow.inbox.api.repository.WebhookEventRepository;
import com.clapgrow.inbox.common.event.WebhookReceivedEvent;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.clapgrow.inbox.common.retry.FailureClassification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for platform webhooks.
 *
 * <p>Every delivery is persisted as PENDING before anything can go wrong with it. It
 * then ends in one of three places:
 * <ul>
 *   <li>PROCESSED: normalized and forwarded on the webhook-received topic (possibly
 *       with zero messages, e.g. a status-only callback).</li>
 *   <li>FAILED: unknown platform or invalid envelope, or the retry budget ran out.</li>
 *   <li>PENDING with a bumped {@code retry_count}: a transient failure that
 *       {@link WebhookRetryService} will pick up again.</li>
 * </ul>
 *
 * <p>Each state change commits in its own short transaction; nothing here holds a
 * transaction open across normalization or the broker round trip.
 */
@Service
@Slf4j
public class WebhookIntakeService {

    private final WebhookEventRepository webhookEventRepository;
    private final NormalizerRegistry normalizerRegistry;
    private final EventPublisher eventPublisher;
    private final InboxProperties properties;
    private final InboxMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final AsyncTaskExecutor normalizerExecutor;

    public WebhookIntakeService(WebhookEventRepository webhookEventRepository,
                                NormalizerRegistry normalizerRegistry,
                                EventPublisher eventPublisher,
                                InboxProperties properties,
                                InboxMetricsService metricsService,
                                ObjectMapper objectMapper,
                                TransactionTemplate transactionTemplate,
                                @Qualifier(NormalizerExecutorConfig.NORMALIZER_EXECUTOR) AsyncTaskExecutor normalizerExecutor) {
        this.webhookEventRepository = webhookEventRepository;
        this.normalizerRegistry = normalizerRegistry;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.normalizerExecutor = normalizerExecutor;
    }

    /**
     * Stores and processes one webhook delivery.
     *
     * @param platform       path tag of the webhook ("whatsapp", "email", ...)
     * @param organizationId organization the webhook URL belongs to
     * @param mediumId       organization medium the delivery arrived on
     * @param rawPayload     request body as received
     * @return the stored event in its final state for this attempt
     */
    public WebhookEvent receive(String platform, UUID organizationId, int mediumId, String rawPayload) {
        JsonNode payload = null;
        String parseError = null;
        try {
            payload = rawPayload == null || rawPayload.isBlank() ? null : objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            parseError = "Invalid JSON payload: " + e.getOriginalMessage();
        }
        if (payload == null && parseError == null) {
            parseError = "Empty payload";
        }

        WebhookEvent event = new WebhookEvent();
        event.setOrganizationId(organizationId);
        event.setMediumId(mediumId);
        event.setPlatform(platform);
        // Unparseable bodies are kept verbatim as a JSON string
        event.setPayload(payload != null ? payload : TextNode.valueOf(rawPayload == null ? "" : rawPayload));
        event.setStatus(WebhookEventStatus.PENDING);
        event.setRetryCount(0);

        WebhookEvent saved = transactionTemplate.execute(status -> webhookEventRepository.save(event));
        metricsService.recordWebhookReceived(platform);
        log.info("Stored webhook event {} for platform {} organization {}", saved.getId(), platform, organizationId);

        if (parseError != null) {
            return markFailed(saved, parseError);
        }
        return process(saved);
    }

    /**
     * Re-runs processing of a PENDING event from its stored payload.
     *
     * @throws ResourceNotFoundException if the event does not exist
     * @throws BadRequestException       if the event already reached PROCESSED or FAILED
     */
    public WebhookEvent reprocess(UUID eventId) {
        WebhookEvent event = webhookEventRepository.findById(eventId)
            .orElseThrow(() -> ResourceNotFoundException.of("Webhook event", eventId));
        if (event.getStatus() != WebhookEventStatus.PENDING) {
            throw new BadRequestException("Webhook event " + eventId + " is " + event.getStatus()
                + "; only PENDING events can be reprocessed");
        }
        log.info("Reprocessing webhook event {} (attempt {})", eventId, event.getRetryCount() + 1);
        return process(event);
    }

    private WebhookEvent process(WebhookEvent event) {
        PlatformNormalizer normalizer = normalizerRegistry.find(event.getPlatform()).orElse(null);
        if (normalizer == null) {
            return markFailed(event, new UnsupportedPlatformException(event.getPlatform()).getMessage());
        }

        try {
            normalizer.validate(event.getPayload());
            List<CanonicalMessage> messages = extractWithTimeout(normalizer, event);

            if (messages.isEmpty()) {
                log.warn("Webhook event {} ({}) contained no messages", event.getId(), event.getPlatform());
            } else {
                WebhookReceivedEvent received = WebhookReceivedEvent.builder()
                    .eventId(WebhookReceivedEvent.eventIdFor(event.getId()))
                    .webhookEventId(event.getId())
                    .organizationId(event.getOrganizationId())
                    .mediumId(event.getMediumId())
                    .platform(normalizer.medium().getTag())
                    .messages(messages)
                    .createdAt(LocalDateTime.now())
                    .build();
                eventPublisher.publish(properties.getEvents().getTopics().getWebhookReceived(), received);
            }
            return markProcessed(event, messages.size());
        } catch (PayloadValidationException e) {
            return markFailed(event, e.getMessage());
        } catch (RuntimeException e) {
            return recordFailure(event, e, classify(e));
        }
    }

    private List<CanonicalMessage> extractWithTimeout(PlatformNormalizer normalizer, WebhookEvent event) {
        Duration timeout = properties.getWebhook().getProcessingTimeout();
        JsonNode payload = event.getPayload();
        Future<List<CanonicalMessage>> future = normalizerExecutor.submit(() -> normalizer.extract(payload));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Interrupts the pool thread; a normalizer that ignores interrupts still holds it until done
            future.cancel(true);
            throw new NormalizationTimeoutException(event.getPlatform(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting webhook event " + event.getId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Extraction failed for webhook event " + event.getId(), cause);
        }
    }

    static FailureClassification classify(RuntimeException e) {
        if (e instanceof PayloadValidationException || e instanceof UnsupportedPlatformException) {
            return FailureClassification.PERMANENT;
        }
        return FailureClassification.TRANSIENT;
    }

    private WebhookEvent markProcessed(WebhookEvent event, int messageCount) {
        event.setStatus(WebhookEventStatus.PROCESSED);
        event.setProcessedAt(LocalDateTime.now());
        event.setErrorMessage(null);
        WebhookEvent saved = transactionTemplate.execute(status -> webhookEventRepository.save(event));
        metricsService.recordWebhookProcessed(event.getPlatform());
        log.info("Webhook event {} processed with {} message(s)", event.getId(), messageCount);
        return saved;
    }

    private WebhookEvent markFailed(WebhookEvent event, String reason) {
        event.setStatus(WebhookEventStatus.FAILED);
        event.setErrorMessage(reason);
        WebhookEvent saved = transactionTemplate.execute(status -> webhookEventRepository.save(event));
        metricsService.recordWebhookFailed(event.getPlatform());
        log.warn("Webhook event {} failed permanently: {}", event.getId(), reason);
        return saved;
    }

    private WebhookEvent recordFailure(WebhookEvent event, RuntimeException error, FailureClassification classification) {
        if (!classification.isRetryable()) {
            return markFailed(event, error.getMessage());
        }
        int attempts = (event.getRetryCount() != null ? event.getRetryCount() : 0) + 1;
        int maxRetries = properties.getWebhook().getMaxRetries();
        event.setRetryCount(attempts);
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (attempts >= maxRetries) {
            log.error("Webhook event {} exhausted {} attempts", event.getId(), attempts, error);
            return markFailed(event, reason);
        }

        event.setErrorMessage(reason);
        WebhookEvent saved = transactionTemplate.execute(status -> webhookEventRepository.save(event));
        metricsService.recordWebhookRetried(event.getPlatform());
        log.warn("Webhook event {} failed transiently (attempt {}/{}): {}", event.getId(), attempts, maxRetries, reason);
        return saved;
    }
}
