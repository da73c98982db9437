package com.flagship.swap_coordinator.secret;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * AES-GCM sealing of secrets at rest. The session id is bound as associated
 * data, so a sealed value copied onto another row fails to open.
 *
 * Sealed form: {@code v1:<base64 iv>:<base64 ciphertext+tag>}.
 */
@Slf4j
public class SecretSealer {

    private static final String SCHEME = "v1";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public SecretSealer(byte[] rawKey) {
        if (rawKey == null || rawKey.length != KEY_BYTES) {
            throw new IllegalArgumentException("Sealing key must be " + KEY_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(rawKey, "AES");
    }

    /**
     * Builds the sealer for the configured session store. A durable store
     * needs a configured key; only the in-memory store, whose secrets die
     * with the process anyway, may fall back to a random one.
     *
     * @throws IllegalStateException if the store is durable and no key is set
     */
    public static SecretSealer forStore(String sessionStore, String base64Key) {
        if (base64Key != null && !base64Key.isBlank()) {
            return fromBase64(base64Key);
        }
        if (!"memory".equals(sessionStore)) {
            throw new IllegalStateException("swap.secrets.encryption-key must be set for the '"
                    + sessionStore + "' session store; sealed secrets would not open after a restart");
        }
        return ephemeral();
    }

    public static SecretSealer fromBase64(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalStateException("Sealing key is not configured");
        }
        return new SecretSealer(Base64.getDecoder().decode(base64Key.trim()));
    }

    /**
     * A random key. Nothing it seals opens after a restart.
     */
    public static SecretSealer ephemeral() {
        log.warn("swap.secrets.encryption-key is not set; using an ephemeral key for the in-memory store");
        byte[] raw = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(raw);
        return new SecretSealer(raw);
    }

    public String seal(UUID sessionId, String secret) {
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(associatedData(sessionId));
            byte[] cipherText = cipher.doFinal(secret.getBytes(StandardCharsets.UTF_8));
            return SCHEME + ":" + Base64.getEncoder().encodeToString(iv)
                    + ":" + Base64.getEncoder().encodeToString(cipherText);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to seal secret for session " + sessionId, e);
        }
    }

    public String open(UUID sessionId, String sealed) {
        String[] parts = sealed.split(":");
        if (parts.length != 3 || !SCHEME.equals(parts[0])) {
            throw new IllegalStateException("Unrecognized sealed secret format for session " + sessionId);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key,
                    new GCMParameterSpec(GCM_TAG_BITS, Base64.getDecoder().decode(parts[1])));
            cipher.updateAAD(associatedData(sessionId));
            byte[] plain = cipher.doFinal(Base64.getDecoder().decode(parts[2]));
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to open sealed secret for session " + sessionId, e);
        }
    }

    private static byte[] associatedData(UUID sessionId) {
        return ByteBuffer.allocate(16)
                .putLong(sessionId.getMostSignificantBits())
                .putLong(sessionId.getLeastSignificantBits())
                .array();
    }
}
