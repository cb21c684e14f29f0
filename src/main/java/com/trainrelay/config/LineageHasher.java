package com.trainrelay.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Content fingerprint of a unit's training parameters.
 *
 * <p>Parameters are canonicalized before digesting: self-referential top-level fields are
 * dropped and map keys are sorted at every depth, so the fingerprint depends only on the
 * values and never on insertion order or on when the file was generated. Lists keep their
 * order because order is meaningful for them (feature lists, layer sizes).
 */
public final class LineageHasher {
    public static final int HASH_LENGTH = 12;
    public static final Set<String> EXCLUDED_FIELDS = Set.of("metadata", "lineage_hash", "config_hash", "generated_at");

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private LineageHasher() {
    }

    public static String hash(Map<String, ?> parameters) {
        String canonical = canonicalForm(parameters);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String canonicalForm(Map<String, ?> parameters) {
        Map<String, Object> stripped = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (!EXCLUDED_FIELDS.contains(key)) {
                    stripped.put(key, canonicalize(value));
                }
            });
        }
        try {
            return CANONICAL_MAPPER.writeValueAsString(stripped);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize unit parameters", e);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), canonicalize(nested)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(canonicalize(item));
            }
            return copy;
        }
        return value;
    }
}
