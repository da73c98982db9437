package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.session.SwapFees;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for session creation. Carries the hashlock, never the secret.
 */
@Value
@Builder
public class SessionResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("status")
    SwapStatus status;

    @JsonProperty("hashlock")
    String hashlock;

    @JsonProperty("estimated_completion_time")
    Instant estimatedCompletionTime;

    @JsonProperty("expiration_time")
    Instant expirationTime;

    @JsonProperty("fees")
    Fees fees;

    public static SessionResponse from(SwapSession session) {
        return SessionResponse.builder()
                .sessionId(session.getSessionId())
                .status(session.getStatus())
                .hashlock(session.getHashlock())
                .estimatedCompletionTime(session.getEstimatedCompletionTime())
                .expirationTime(session.getExpirationTime())
                .fees(Fees.from(session.getFees()))
                .build();
    }

    @Value
    public static class Fees {

        @JsonProperty("protocol_fee_bps")
        int protocolFeeBps;

        @JsonProperty("protocol_fee")
        String protocolFee;

        @JsonProperty("network_fees")
        Map<String, String> networkFees;

        static Fees from(SwapFees fees) {
            if (fees == null) {
                return null;
            }
            return new Fees(fees.getProtocolFeeBps(), fees.getProtocolFeeAmount().toString(), fees.getNetworkFees());
        }
    }
}
