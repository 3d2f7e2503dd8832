package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Network state as observed by the shell.
 */
@Value
public class ConnectivityRequest {

    @NotNull(message = "Online flag is required")
    @JsonProperty("online")
    Boolean online;
}
