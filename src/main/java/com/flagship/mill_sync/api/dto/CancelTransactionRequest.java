package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CancelTransactionRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
