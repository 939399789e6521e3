package com.clapgrow.inbox.api.controller;

import com.clapgrow.inbox.api.dto.ApiResponse;
import com.clapgrow.inbox.api.dto.ConversationResponse;
import com.clapgrow.inbox.api.dto.ConversationUpdateRequest;
import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.service.BadRequestException;
import com.clapgrow.inbox.api.service.ConversationResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
@Tag(name = "Conversations", description = "Conversation triage")
public class ConversationController {

    private final ConversationResolver conversationResolver;

    @PatchMapping("/{conversationId}")
    @Operation(summary = "Change status and/or priority")
    public ResponseEntity<ApiResponse<ConversationResponse>> update(
            @PathVariable UUID conversationId,
            @RequestBody ConversationUpdateRequest request) {

        if (request.getStatus() == null && request.getPriority() == null) {
            throw new BadRequestException("Nothing to update: provide status or priority");
        }
        Conversation conversation = null;
        if (request.getStatus() != null) {
            conversation = conversationResolver.updateStatus(conversationId, request.getStatus());
        }
        if (request.getPriority() != null) {
            conversation = conversationResolver.updatePriority(conversationId, request.getPriority());
        }
        return ResponseEntity.ok(ApiResponse.success(ConversationResponse.from(conversation)));
    }

    /**
     * The next inbound message from the same contact on the same medium opens a new conversation.
     */
    @PostMapping("/{conversationId}/deactivate")
    @Operation(summary = "Deactivate a conversation")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deactivate(@PathVariable UUID conversationId) {
        boolean changed = conversationResolver.deactivate(conversationId);
        return ResponseEntity.ok(ApiResponse.success(Map.of("conversationId", conversationId, "deactivated", changed)));
    }
}
