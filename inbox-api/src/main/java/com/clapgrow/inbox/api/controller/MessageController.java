package com.clapgrow.inbox.api.controller;

import com.clapgrow.inbox.api.dto.ApiResponse;
import com.clapgrow.inbox.api.dto.MessageResponse;
import com.clapgrow.inbox.api.dto.MessageStatusUpdateRequest;
import com.clapgrow.inbox.api.dto.MessageStatusUpdateResponse;
import com.clapgrow.inbox.api.service.BadRequestException;
import com.clapgrow.inbox.api.service.MessageLifecycleService;
import com.clapgrow.inbox.api.service.StatusUpdateResult;
import com.clapgrow.inbox.common.enums.MessageStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
@Tag(name = "Messages", description = "Messages and delivery status")
public class MessageController {

    private final MessageLifecycleService messageLifecycleService;

    @GetMapping("/{messageId}")
    @Operation(summary = "Get a message")
    public ResponseEntity<ApiResponse<MessageResponse>> getMessage(@PathVariable UUID messageId) {
        return ResponseEntity.ok(ApiResponse.success(MessageResponse.from(messageLifecycleService.getMessage(messageId))));
    }

    @PutMapping("/{messageId}/status")
    @Operation(summary = "Update delivery status",
               description = "Applies a delivery receipt. Repeats are no-ops and backward moves are rejected.")
    public ResponseEntity<ApiResponse<MessageStatusUpdateResponse>> updateStatus(
            @PathVariable UUID messageId,
            @Valid @RequestBody MessageStatusUpdateRequest request) {

        MessageStatus status;
        try {
            status = MessageStatus.parse(request.getStatus());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
        StatusUpdateResult result = messageLifecycleService.updateStatus(messageId, status, request.getFailureReason());
        return ResponseEntity.ok(ApiResponse.success(new MessageStatusUpdateResponse(messageId, status, result)));
    }
}
