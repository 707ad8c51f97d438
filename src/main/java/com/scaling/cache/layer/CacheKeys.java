package com.scaling.cache.layer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaling.exception.CacheSerializationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Builds namespaced cache keys of the form {@code <namespace>:<category>:<digest>}.
 * <p>
 * The digest is the SHA-256 of the identifiers serialized as a JSON array with map entries
 * sorted by key, so {@code ("a", "bc")} and {@code ("ab", "c")} never share a key and the
 * same identifiers always produce the same one.
 */
public class CacheKeys {

    private static final String SEPARATOR = ":";

    private final String namespace;
    private final ObjectMapper objectMapper;

    public CacheKeys(String namespace, ObjectMapper objectMapper) {
        this.namespace = namespace;
        this.objectMapper = objectMapper;
    }

    public String key(String category, Object... identifiers) {
        return prefix(category) + digest(identifiers);
    }

    /**
     * Glob matching every key of a category.
     */
    public String categoryPattern(String category) {
        return prefix(category) + "*";
    }

    /**
     * Glob for a caller-supplied pattern, scoped to this namespace.
     */
    public String namespacedPattern(String pattern) {
        return namespace + SEPARATOR + pattern;
    }

    private String prefix(String category) {
        return namespace + SEPARATOR + category + SEPARATOR;
    }

    String digest(Object... identifiers) {
        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(Arrays.asList(identifiers));
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Cannot build cache key from " + Arrays.toString(identifiers), e);
        }
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
