package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.session.EscrowLeg;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import com.flagship.swap_coordinator.session.SwapStep;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Full view of a session for status queries and listings.
 */
@Value
@Builder
public class SessionStatusResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("status")
    SwapStatus status;

    @JsonProperty("phase")
    String phase;

    @JsonProperty("progress")
    int progress;

    @JsonProperty("steps")
    List<SwapStep> steps;

    @JsonProperty("source_chain")
    String sourceChain;

    @JsonProperty("destination_chain")
    String destinationChain;

    @JsonProperty("source_amount")
    String sourceAmount;

    @JsonProperty("destination_amount")
    String destinationAmount;

    @JsonProperty("maker")
    String maker;

    @JsonProperty("taker")
    String taker;

    @JsonProperty("hashlock")
    String hashlock;

    @JsonProperty("src_escrow_id")
    String srcEscrowId;

    @JsonProperty("dst_escrow_id")
    String dstEscrowId;

    @JsonProperty("source_leg")
    String sourceLegState;

    @JsonProperty("destination_leg")
    String destinationLegState;

    @JsonProperty("degraded")
    boolean degraded;

    @JsonProperty("degraded_reason")
    String degradedReason;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    /** Seconds until expiration, zero once expired or terminal. */
    @JsonProperty("time_remaining")
    long timeRemaining;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("expiration_time")
    Instant expirationTime;

    public static SessionStatusResponse from(SwapSession session, Instant now) {
        SwapStatus status = session.getStatus();
        return SessionStatusResponse.builder()
                .sessionId(session.getSessionId())
                .status(status)
                .phase(status.phase())
                .progress(status.progress())
                .steps(session.getSteps())
                .sourceChain(session.getSourceChain())
                .destinationChain(session.getDestinationChain())
                .sourceAmount(session.getSourceAmount().toString())
                .destinationAmount(session.getDestinationAmount().toString())
                .maker(session.getMaker())
                .taker(session.getTaker())
                .hashlock(session.getHashlock())
                .srcEscrowId(session.getSourceLeg().getEscrowId())
                .dstEscrowId(session.getDestinationLeg().getEscrowId())
                .sourceLegState(legState(session.getSourceLeg()))
                .destinationLegState(legState(session.getDestinationLeg()))
                .degraded(session.isDegraded())
                .degradedReason(session.getDegradedReason())
                .cancellationReason(session.getCancellationReason())
                .timeRemaining(session.timeRemaining(now).getSeconds())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .expirationTime(session.getExpirationTime())
                .build();
    }

    private static String legState(EscrowLeg leg) {
        return leg.getState().name().toLowerCase();
    }
}
