package com.vbwd.plugin.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of persisted plugin rows and config blobs. Timestamps are epoch milliseconds; the config
 * blob is written as a nested JSON object.
 */
public final class PersistedPluginConfigCodec {

    static final String FIELD_PLUGIN_NAME = "plugin_name";
    static final String FIELD_STATUS = "status";
    static final String FIELD_CONFIG = "config";
    static final String FIELD_ENABLED_AT = "enabled_at";
    static final String FIELD_DISABLED_AT = "disabled_at";
    static final String FIELD_UPDATED_AT = "updated_at";

    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PersistedPluginConfigCodec() {
        this(new ObjectMapper());
    }

    public PersistedPluginConfigCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public ObjectNode toNode(PersistedPluginConfig row) {
        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_PLUGIN_NAME, row.pluginName());
        node.put(FIELD_STATUS, row.status().getWireValue());
        node.set(FIELD_CONFIG, mapper.valueToTree(row.config()));
        putInstant(node, FIELD_ENABLED_AT, row.enabledAt());
        putInstant(node, FIELD_DISABLED_AT, row.disabledAt());
        putInstant(node, FIELD_UPDATED_AT, row.updatedAt());
        return node;
    }

    /**
     * @throws IllegalArgumentException if the node is not a valid row
     */
    public PersistedPluginConfig fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Persisted plugin row must be a JSON object");
        }
        JsonNode name = node.get(FIELD_PLUGIN_NAME);
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new IllegalArgumentException("Persisted plugin row has no " + FIELD_PLUGIN_NAME);
        }
        PersistedStatus status = PersistedStatus.fromWireValue(node.path(FIELD_STATUS).asText(null));
        Map<String, Object> config = node.hasNonNull(FIELD_CONFIG)
                ? mapper.convertValue(node.get(FIELD_CONFIG), CONFIG_TYPE)
                : Map.of();
        return new PersistedPluginConfig(name.asText(), status, config,
                readInstant(node, FIELD_ENABLED_AT), readInstant(node, FIELD_DISABLED_AT), readInstant(node, FIELD_UPDATED_AT));
    }

    public String toJson(PersistedPluginConfig row) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(row));
    }

    public PersistedPluginConfig fromJson(String json) throws JsonProcessingException {
        return fromNode(mapper.readTree(json));
    }

    /** Serializes a config blob; null gives {@code {}}. */
    public String configToJson(Map<String, Object> config) throws JsonProcessingException {
        return mapper.writeValueAsString(config != null ? config : Map.of());
    }

    /** Parses a config blob; null or blank gives an empty map. */
    public Map<String, Object> configFromJson(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return mapper.readValue(json, CONFIG_TYPE);
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.toEpochMilli());
        }
    }

    private static Instant readInstant(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.canConvertToLong()) {
            throw new IllegalArgumentException("Persisted plugin row field " + field + " is not epoch millis: " + v);
        }
        return Instant.ofEpochMilli(v.asLong());
    }
}
