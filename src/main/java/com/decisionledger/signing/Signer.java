package com.decisionledger.signing;

import javax.crypto.Mac;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Keyed signatures over canonical bytes.
 *
 * Signatures carry an algorithm tag ({@code hmac-sha256:<hex>}) so the scheme
 * can be rotated without ambiguity. Stateless apart from the immutable key:
 * concurrent use needs no locking.
 */
public class Signer {

    public static final String ALGORITHM_TAG = "hmac-sha256";
    private static final String PREFIX = ALGORITHM_TAG + ":";
    private static final HexFormat HEX = HexFormat.of();

    private final SigningKey key;
    private final Canonicalizer canonicalizer;

    public Signer(SigningKey key, Canonicalizer canonicalizer) {
        this.key = Objects.requireNonNull(key, "signing key is required");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer is required");
    }

    public byte[] canonicalize(Map<String, ?> fields) {
        return canonicalizer.canonicalize(fields);
    }

    public String sign(byte[] canonicalBytes) {
        Objects.requireNonNull(canonicalBytes, "bytes to sign cannot be null");
        return PREFIX + HEX.formatHex(mac(canonicalBytes));
    }

    /**
     * Recomputes the digest and compares in constant time. A malformed
     * signature or an unknown algorithm tag is simply not valid.
     */
    public boolean verify(byte[] canonicalBytes, String signature) {
        if (canonicalBytes == null || signature == null || !signature.startsWith(PREFIX)) {
            return false;
        }
        byte[] presented;
        try {
            presented = HEX.parseHex(signature.substring(PREFIX.length()));
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return MessageDigest.isEqual(mac(canonicalBytes), presented);
    }

    public String signFields(Map<String, ?> fields) {
        return sign(canonicalize(fields));
    }

    public boolean verifyFields(Map<String, ?> fields, String signature) {
        return verify(canonicalize(fields), signature);
    }

    private byte[] mac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(SigningKey.MAC_ALGORITHM);
            mac.init(key.keySpec());
            return mac.doFinal(data);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException(SigningKey.MAC_ALGORITHM + " is unavailable", ex);
        }
    }
}
