package com.clapgrow.inbox.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * Delivery callback body. {@code status} is either the wire ordinal ("2") or a
 * name ("delivered").
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageStatusUpdateRequest {

    @NotBlank(message = "status is required")
    private String status;

    @Size(max = 1000, message = "failureReason must be at most 1000 characters")
    private String failureReason;
}
