package com.decisionledger.ledger;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Record identifiers: {@code <prefix>-<yyyyMMdd>-<12 lowercase hex chars>}.
 * The suffix carries 48 bits from a {@link SecureRandom} and never contains a hyphen.
 */
public final class RecordIds {

    public static final String EVENT_PREFIX = "evt";
    public static final String OVERRIDE_PREFIX = "ovr";

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private RecordIds() {
    }

    public static String eventId(Instant now) {
        return next(EVENT_PREFIX, now);
    }

    public static String overrideId(Instant now) {
        return next(OVERRIDE_PREFIX, now);
    }

    private static String next(String prefix, Instant now) {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return prefix + "-" + DAY.format(now) + "-" + HEX.formatHex(bytes);
    }
}
