package com.decisionledger.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic byte encoding of a record's signable fields.
 *
 * Compact UTF-8 JSON with:
 * - keys sorted lexicographically at every level
 * - null and absent values written as {@code null}
 * - instants as ISO-8601 UTC, second precision ({@code 2026-01-31T12:00:00Z})
 * - enums through their JSON value, collections in iteration order
 *
 * The same logical content always yields the same bytes regardless of
 * construction order.
 */
public class Canonicalizer {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper mapper;

    public Canonicalizer() {
        this.mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public byte[] canonicalize(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(normalize(fields));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("record is not canonicalizable: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    private Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(normalize(item));
            }
            return items;
        }
        if (value instanceof Instant instant) {
            return formatTimestamp(instant);
        }
        return value;
    }
}
