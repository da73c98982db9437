package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SecretRequest {

    @NotBlank(message = "Requester is required")
    @JsonProperty("requester")
    String requester;
}
