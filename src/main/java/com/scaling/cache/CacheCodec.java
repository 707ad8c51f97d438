package com.scaling.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scaling.exception.CacheSerializationException;

/**
 * The single encoding used for every cached value: a versioned JSON envelope
 * {@code {"v":1,"data":<value>}}.
 * <p>
 * Payloads without the envelope or with another version are rejected rather than guessed at.
 */
public class CacheCodec {

    public static final int VERSION = 1;

    private static final String VERSION_FIELD = "v";
    private static final String DATA_FIELD = "data";

    private final ObjectMapper objectMapper;

    public CacheCodec() {
        this(defaultObjectMapper());
    }

    public CacheCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return mapper;
    }

    public String encode(Object value) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(VERSION_FIELD, VERSION);
        try {
            envelope.set(DATA_FIELD, objectMapper.valueToTree(value));
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String typeName = value != null ? value.getClass().getName() : "null";
            throw new CacheSerializationException("Cannot encode " + typeName, e);
        }
    }

    public <T> T decode(String payload, Class<T> type) {
        return decode(payload, objectMapper.constructType(type));
    }

    public <T> T decode(String payload, JavaType type) {
        JsonNode data = unwrap(payload);
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CacheSerializationException("Cannot decode cached value as " + type, e);
        }
    }

    private JsonNode unwrap(String payload) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException("Cached payload is not JSON", e);
        }
        if (envelope == null || !envelope.isObject() || !envelope.has(VERSION_FIELD)) {
            throw new CacheSerializationException("Cached payload has no version envelope");
        }
        int version = envelope.get(VERSION_FIELD).asInt(-1);
        if (version != VERSION) {
            throw new CacheSerializationException("Unsupported cache encoding version " + version);
        }
        return envelope.get(DATA_FIELD);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
