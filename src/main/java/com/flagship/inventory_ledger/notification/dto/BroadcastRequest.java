package com.flagship.inventory_ledger.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.common.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class BroadcastRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title cannot exceed 255 characters")
    @JsonProperty("title")
    String title;

    @NotBlank(message = "Message is required")
    @JsonProperty("message")
    String message;

    // Null sends to every active user
    @JsonProperty("target_role")
    Role targetRole;
}
