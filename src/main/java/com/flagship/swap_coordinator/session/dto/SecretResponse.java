package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;
import lombok.Value;

import java.util.UUID;

@Value
public class SecretResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @ToString.Exclude
    @JsonProperty("secret")
    String secret;

    @JsonProperty("hashlock")
    String hashlock;
}
