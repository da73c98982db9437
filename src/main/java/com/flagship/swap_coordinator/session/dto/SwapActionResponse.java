package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Acknowledgement of an execute or cancel request. The swap itself moves on
 * asynchronously; clients follow it through the status or events endpoints.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SwapActionResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("status")
    SwapStatus status;

    @JsonProperty("message")
    String message;

    @JsonProperty("tracking_url")
    String trackingUrl;

    @JsonProperty("refund_address")
    String refundAddress;
}
