package com.clapgrow.inbox.api.controller;

import com.clapgrow.inbox.api.dto.ApiResponse;
import com.clapgrow.inbox.api.dto.WebhookAcceptedResponse;
import com.clapgrow.inbox.api.entity.WebhookEvent;
import com.clapgrow.inbox.api.service.WebhookIntakeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Inbound platform webhooks")
public class WebhookController {

    private final WebhookIntakeService webhookIntakeService;

    /**
     * Accepts a raw platform payload. The body is stored before normalization, so
     * even a payload that fails is acknowledged with 202 and its stored status.
     */
    @PostMapping("/{platform}")
    @Operation(summary = "Receive a platform webhook",
               description = "Persists the raw payload, normalizes it and forwards the messages to ingestion.")
    public ResponseEntity<ApiResponse<WebhookAcceptedResponse>> receive(
            @PathVariable String platform,
            @RequestParam UUID organizationId,
            @RequestParam(defaultValue = "0") int mediumId,
            @RequestBody(required = false) String payload) {

        WebhookEvent event = webhookIntakeService.receive(platform, organizationId, mediumId, payload);
        WebhookAcceptedResponse body = new WebhookAcceptedResponse(
            event.getId(), event.getStatus(), event.getErrorMessage());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(body));
    }

    @PostMapping("/events/{eventId}/reprocess")
    @Operation(summary = "Re-run a pending webhook event",
               description = "Normalizes the stored payload again. Only PENDING events can be reprocessed.")
    public ResponseEntity<ApiResponse<WebhookAcceptedResponse>> reprocess(@PathVariable UUID eventId) {
        WebhookEvent event = webhookIntakeService.reprocess(eventId);
        return ResponseEntity.ok(ApiResponse.success(
            new WebhookAcceptedResponse(event.getId(), event.getStatus(), event.getErrorMessage())));
    }
}
