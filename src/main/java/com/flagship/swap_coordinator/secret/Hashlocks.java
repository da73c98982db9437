package com.flagship.swap_coordinator.secret;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.security.SecureRandom;

/**
 * Hashlock helpers shared by the secret custody and the coordinator.
 *
 * A secret is 32 random bytes written as {@code 0x}-prefixed lowercase hex;
 * its commitment is the keccak-256 of the raw bytes, in the same notation,
 * which is what EVM escrow contracts compare against.
 */
public final class Hashlocks {

    public static final int SECRET_LENGTH_BYTES = 32;

    private static final String HEX_PREFIX = "0x";

    private Hashlocks() {
    }

    public static String newSecret(SecureRandom random) {
        byte[] bytes = new byte[SECRET_LENGTH_BYTES];
        random.nextBytes(bytes);
        return toHex(bytes);
    }

    public static String commit(String secret) {
        return toHex(keccak256(fromHex(secret)));
    }

    /**
     * Checks a candidate secret against a commitment. Malformed input never
     * matches.
     */
    public static boolean matches(String secret, String commitment) {
        if (secret == null || commitment == null) {
            return false;
        }
        try {
            return commit(secret).equalsIgnoreCase(commitment);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }

    static String toHex(byte[] bytes) {
        return HEX_PREFIX + Hex.toHexString(bytes);
    }

    static byte[] fromHex(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Hex value is required");
        }
        String digits = value.startsWith(HEX_PREFIX) ? value.substring(2) : value;
        if (digits.length() % 2 != 0 || !digits.matches("[0-9a-fA-F]*")) {
            throw new IllegalArgumentException("Not a hex string: " + value.length() + " chars");
        }
        return Hex.decode(digits);
    }
}
