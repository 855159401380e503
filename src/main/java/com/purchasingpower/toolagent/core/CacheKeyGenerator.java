package com.purchasingpower.toolagent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Derives cache keys from request parameters.
 *
 * <p>Parameters are rendered as canonical JSON (map keys sorted at every level)
 * and hashed with SHA-256, so equal parameter content always yields the same
 * key regardless of map iteration order. Sets are serialized in iteration order;
 * pass lists where order matters. Values without any serializable property are
 * rejected rather than rendered as {@code {}}, since two such values would
 * otherwise share a key.
 *
 * @since 1.0.0
 */
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator() {
        this.canonicalMapper = createCanonicalMapper();
    }

    /**
     * @throws IllegalArgumentException if the parameters cannot be serialized
     */
    public String generate(Map<String, Object> params) {
        Map<String, Object> safeParams = params != null ? params : Map.of();
        try {
            String canonical = canonicalMapper.writeValueAsString(safeParams);
            return Hashing.sha256()
                .hashString(canonical, StandardCharsets.UTF_8)
                .toString();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectMapper createCanonicalMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
