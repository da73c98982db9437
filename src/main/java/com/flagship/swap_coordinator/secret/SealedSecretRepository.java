package com.flagship.swap_coordinator.secret;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface SealedSecretRepository extends JpaRepository<SealedSecretEntity, UUID> {

    /**
     * Sets disclosed_at only if it is still empty. Returns 1 for the first
     * disclosure, 0 afterwards.
     */
    @Modifying
    @Query("""
        UPDATE SealedSecretEntity s SET s.disclosedAt = :at
        WHERE s.sessionId = :sessionId AND s.disclosedAt IS NULL
        """)
    int markDisclosed(@Param("sessionId") UUID sessionId, @Param("at") Instant at);
}
