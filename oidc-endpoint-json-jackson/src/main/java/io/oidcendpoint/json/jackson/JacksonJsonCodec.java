package io.oidcendpoint.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.oidcendpoint.json.spi.JsonCodec;
import io.oidcendpoint.json.spi.JsonException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson implementation of JsonCodec.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this.mapper = new ObjectMapper(new JsonFactory());
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public Map<String, Object> readMap(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot read a JSON object from empty input");
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to a JSON object", e);
        }
    }
}
