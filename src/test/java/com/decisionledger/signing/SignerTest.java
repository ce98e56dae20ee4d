package com.decisionledger.signing;

import com.decisionledger.signal.Decision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class SignerTest {

    private Signer signer;

    @BeforeEach
    void setUp() {
        signer = new Signer(SigningKey.fromSecret("unit-test-secret-0123456789"), new Canonicalizer());
    }

    @Nested
    @DisplayName("Canonical form")
    class CanonicalForm {

        @Test
        void keyOrder_doesNotChangeBytes() {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("user", "alice");
            a.put("decision", Decision.BLOCK);
            a.put("nested", new LinkedHashMap<>(Map.of("z", 1, "a", 2)));
            Map<String, Object> b = new TreeMap<>();
            b.put("nested", new HashMap<>(Map.of("a", 2, "z", 1)));
            b.put("decision", Decision.BLOCK);
            b.put("user", "alice");

            assertArrayEquals(signer.canonicalize(a), signer.canonicalize(b));
        }

        @Test
        void compactJson_withSortedKeysNullsAndSecondPrecision() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("timestamp", Instant.parse("2026-01-31T12:00:00.987Z"));
            fields.put("duration", null);
            fields.put("tags", List.of("b", "a"));
            fields.put("decision", Decision.FLAG);

            String json = new String(signer.canonicalize(fields), StandardCharsets.UTF_8);

            assertEquals("{\"decision\":\"flag\",\"duration\":null,\"tags\":[\"b\",\"a\"],"
                + "\"timestamp\":\"2026-01-31T12:00:00Z\"}", json);
        }
    }

    @Nested
    @DisplayName("Sign and verify")
    class SignAndVerify {

        @Test
        void signature_hasAlgorithmTag() {
            String signature = signer.signFields(Map.of("event_id", "evt-1"));
            assertTrue(signature.startsWith("hmac-sha256:"));
            assertEquals("hmac-sha256:".length() + 64, signature.length());
        }

        @Test
        void untouchedFields_verify() {
            Map<String, Object> fields = Map.of("event_id", "evt-1", "decision", "block");
            assertTrue(signer.verifyFields(fields, signer.signFields(fields)));
        }

        @Test
        void anySingleFieldChange_failsVerification() {
            Map<String, Object> fields = new HashMap<>(Map.of("event_id", "evt-1", "decision", "block", "user", "alice"));
            String signature = signer.signFields(fields);

            for (String key : List.copyOf(fields.keySet())) {
                Map<String, Object> tampered = new HashMap<>(fields);
                tampered.put(key, fields.get(key) + "x");
                assertFalse(signer.verifyFields(tampered, signature), "tampering with " + key + " must be detected");
            }
        }

        @Test
        void differentKey_failsVerification() {
            Signer other = new Signer(SigningKey.fromSecret("another-secret-0123456789"), new Canonicalizer());
            Map<String, Object> fields = Map.of("event_id", "evt-1");
            assertFalse(other.verifyFields(fields, signer.signFields(fields)));
        }

        @Test
        void malformedOrForeignSignatures_areInvalidNotErrors() {
            byte[] bytes = signer.canonicalize(Map.of("a", 1));
            assertFalse(signer.verify(bytes, null));
            assertFalse(signer.verify(bytes, "sha1:abcd"));
            assertFalse(signer.verify(bytes, "hmac-sha256:not-hex"));
            assertFalse(signer.verify(bytes, "hmac-sha256:abcd"));
        }
    }

    @Nested
    @DisplayName("Signing key")
    class Key {

        @Test
        void blankOrShortSecret_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> SigningKey.fromSecret(" "));
            assertThrows(IllegalArgumentException.class, () -> SigningKey.fromSecret("short"));
        }

        @Test
        void toString_masksSecret() {
            assertFalse(SigningKey.fromSecret("unit-test-secret-0123456789").toString().contains("unit-test"));
        }
    }
}
