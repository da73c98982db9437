package com.flagship.swap_coordinator.session;

import com.flagship.swap_coordinator.secret.SecretSealer;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for swap sessions.
 *
 * Key design principles (same as every entity in this service):
 * - No setters: state only enters through {@link #fromDomain} and
 *   {@link #updateFromDomain}
 * - Parties, chains, tokens, amounts and the hashlock are updatable = false
 * - Optimistic locking through {@code version}; the coordinator is the only
 *   writer, so a conflict means a second node is driving the same session
 * - Timestamps come from the domain object, which takes them from the
 *   injected clock
 *
 * The idempotency key is a persistence concern and is passed separately.
 */
@Entity
@Table(
    name = "swap_sessions",
    indexes = {
        @Index(name = "idx_swap_sessions_status", columnList = "status"),
        @Index(name = "idx_swap_sessions_src_escrow", columnList = "src_escrow_id"),
        @Index(name = "idx_swap_sessions_dst_escrow", columnList = "dst_escrow_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SwapSessionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_chain", nullable = false, updatable = false, length = 32)
    private String sourceChain;

    @Column(name = "destination_chain", nullable = false, updatable = false, length = 32)
    private String destinationChain;

    @Column(name = "source_token", nullable = false, updatable = false)
    private String sourceToken;

    @Column(name = "destination_token", nullable = false, updatable = false)
    private String destinationToken;

    @Column(name = "source_amount", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger sourceAmount;

    @Column(name = "destination_amount", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger destinationAmount;

    @Column(nullable = false, updatable = false)
    private String maker;

    @Column(nullable = false, updatable = false)
    private String taker;

    @Column(name = "slippage_tolerance_bps", nullable = false, updatable = false)
    private int slippageToleranceBps;

    @Column(nullable = false, updatable = false, unique = true, length = 66)
    private String hashlock;

    /**
     * The revealed secret, sealed. Written once, on disclosure or when a
     * withdrawal reveals it.
     */
    @Column(name = "sealed_secret", columnDefinition = "TEXT")
    private String sealedSecret;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SwapStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "swap_session_steps", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    private List<SwapStepEmbeddable> steps = new ArrayList<>();

    @Column(name = "src_escrow_id")
    private String srcEscrowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "src_leg_state", nullable = false, length = 32)
    private LegState srcLegState;

    @Column(name = "src_locked_amount", precision = 78, scale = 0)
    private BigInteger srcLockedAmount;

    @Column(name = "src_cancellation_deadline")
    private Instant srcCancellationDeadline;

    @Column(name = "src_submitted_at")
    private Instant srcSubmittedAt;

    @Column(name = "dst_escrow_id")
    private String dstEscrowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dst_leg_state", nullable = false, length = 32)
    private LegState dstLegState;

    @Column(name = "dst_locked_amount", precision = 78, scale = 0)
    private BigInteger dstLockedAmount;

    @Column(name = "dst_cancellation_deadline")
    private Instant dstCancellationDeadline;

    @Column(name = "dst_submitted_at")
    private Instant dstSubmittedAt;

    @Column(name = "protocol_fee_bps", nullable = false, updatable = false)
    private int protocolFeeBps;

    @Column(name = "protocol_fee_amount", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger protocolFeeAmount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "network_fees", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, String> networkFees = new HashMap<>();

    @Column(nullable = false)
    private boolean degraded;

    @Column(name = "degraded_reason", columnDefinition = "TEXT")
    private String degradedReason;

    @Column(name = "cancellation_reason", length = 64)
    private String cancellationReason;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expiration_time", nullable = false, updatable = false)
    private Instant expirationTime;

    @Column(name = "estimated_completion_time", updatable = false)
    private Instant estimatedCompletionTime;

    @Version
    private long version;

    /**
     * Controlled factory, the only way to create session entities.
     */
    static SwapSessionEntity fromDomain(SwapSession session, String idempotencyKey, SecretSealer sealer) {
        SwapSessionEntity entity = new SwapSessionEntity();
        entity.id = session.getSessionId();
        entity.sourceChain = session.getSourceChain();
        entity.destinationChain = session.getDestinationChain();
        entity.sourceToken = session.getSourceToken();
        entity.destinationToken = session.getDestinationToken();
        entity.sourceAmount = session.getSourceAmount();
        entity.destinationAmount = session.getDestinationAmount();
        entity.maker = session.getMaker();
        entity.taker = session.getTaker();
        entity.slippageToleranceBps = session.getSlippageToleranceBps();
        entity.hashlock = session.getHashlock();
        entity.protocolFeeBps = session.getFees().getProtocolFeeBps();
        entity.protocolFeeAmount = session.getFees().getProtocolFeeAmount();
        entity.networkFees = new HashMap<>(session.getFees().getNetworkFees());
        entity.idempotencyKey = idempotencyKey;
        entity.createdAt = session.getCreatedAt();
        entity.expirationTime = session.getExpirationTime();
        entity.estimatedCompletionTime = session.getEstimatedCompletionTime();
        entity.updateFromDomain(session, sealer);
        return entity;
    }

    /**
     * Copies the mutable part of the session: status, steps, legs, secret
     * and flags. Everything fixed at creation is left alone.
     */
    void updateFromDomain(SwapSession session, SecretSealer sealer) {
        if (session.getSecret() == null) {
            this.sealedSecret = null;
        } else if (this.sealedSecret == null) {
            this.sealedSecret = sealer.seal(id, session.getSecret());
        }
        this.status = session.getStatus();
        this.steps.clear();
        session.getSteps().forEach(step -> this.steps.add(SwapStepEmbeddable.fromDomain(step)));

        EscrowLeg src = session.getSourceLeg();
        this.srcEscrowId = src.getEscrowId();
        this.srcLegState = src.getState();
        this.srcLockedAmount = src.getAmount();
        this.srcCancellationDeadline = src.getCancellationDeadline();
        this.srcSubmittedAt = src.getSubmittedAt();

        EscrowLeg dst = session.getDestinationLeg();
        this.dstEscrowId = dst.getEscrowId();
        this.dstLegState = dst.getState();
        this.dstLockedAmount = dst.getAmount();
        this.dstCancellationDeadline = dst.getCancellationDeadline();
        this.dstSubmittedAt = dst.getSubmittedAt();

        this.degraded = session.isDegraded();
        this.degradedReason = session.getDegradedReason();
        this.cancellationReason = session.getCancellationReason();
        this.updatedAt = session.getUpdatedAt();
    }

    public SwapSession toDomain(SecretSealer sealer) {
        return SwapSession.builder()
                .sessionId(id)
                .sourceChain(sourceChain)
                .destinationChain(destinationChain)
                .sourceToken(sourceToken)
                .destinationToken(destinationToken)
                .sourceAmount(sourceAmount)
                .destinationAmount(destinationAmount)
                .maker(maker)
                .taker(taker)
                .slippageToleranceBps(slippageToleranceBps)
                .hashlock(hashlock)
                .secret(sealedSecret == null ? null : sealer.open(id, sealedSecret))
                .status(status)
                .steps(steps.stream().map(SwapStepEmbeddable::toDomain).toList())
                .sourceLeg(new EscrowLeg(ChainRole.SOURCE, srcEscrowId, srcLegState, srcLockedAmount,
                        srcCancellationDeadline, srcSubmittedAt))
                .destinationLeg(new EscrowLeg(ChainRole.DESTINATION, dstEscrowId, dstLegState, dstLockedAmount,
                        dstCancellationDeadline, dstSubmittedAt))
                .fees(new SwapFees(protocolFeeBps, protocolFeeAmount, Map.copyOf(networkFees)))
                .degraded(degraded)
                .degradedReason(degradedReason)
                .cancellationReason(cancellationReason)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .expirationTime(expirationTime)
                .estimatedCompletionTime(estimatedCompletionTime)
                .build();
    }
}
