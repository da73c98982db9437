package com.flagship.swap_coordinator.secret;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of swap_secrets. Holds only the sealed form.
 */
@Entity
@Table(name = "swap_secrets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SealedSecretEntity {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "sealed_secret", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String sealedSecret;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "disclosed_at")
    private Instant disclosedAt;

    static SealedSecretEntity create(UUID sessionId, String sealedSecret, Instant createdAt) {
        return new SealedSecretEntity(sessionId, sealedSecret, createdAt, null);
    }
}
