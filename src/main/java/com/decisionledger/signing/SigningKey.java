package com.decisionledger.signing;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Process-wide HMAC secret. Immutable after construction and safe to share
 * between threads.
 */
public final class SigningKey {

    static final String MAC_ALGORITHM = "HmacSHA256";
    private static final int MIN_SECRET_BYTES = 16;

    private final SecretKeySpec keySpec;

    private SigningKey(byte[] secret) {
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                "signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.keySpec = new SecretKeySpec(Arrays.copyOf(secret, secret.length), MAC_ALGORITHM);
    }

    public static SigningKey fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("signing secret is required");
        }
        return new SigningKey(secret.getBytes(StandardCharsets.UTF_8));
    }

    SecretKeySpec keySpec() {
        return keySpec;
    }

    @Override
    public String toString() {
        return "SigningKey[" + MAC_ALGORITHM + ", secret=****]";
    }
}
