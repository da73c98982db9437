package com.flagship.swap_coordinator.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for swap session persistence.
 */
@Repository
public interface SwapSessionRepository extends JpaRepository<SwapSessionEntity, UUID>,
        JpaSpecificationExecutor<SwapSessionEntity> {

    Optional<SwapSessionEntity> findByHashlockIgnoreCase(String hashlock);

    /**
     * Escrow ids are only unique per ledger, so a match on either column is
     * enough to find the owning session.
     */
    @Query("SELECT s FROM SwapSessionEntity s WHERE s.srcEscrowId = :escrowId OR s.dstEscrowId = :escrowId")
    Optional<SwapSessionEntity> findByEscrowId(@Param("escrowId") String escrowId);

    @Query("SELECT s.id FROM SwapSessionEntity s WHERE s.idempotencyKey = :key")
    Optional<UUID> findIdByIdempotencyKey(@Param("key") String idempotencyKey);

    long countByStatusNotIn(Collection<SwapStatus> statuses);
}
