package com.memic.sdk.common.json.jackson;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.MapType;
import com.memic.sdk.common.json.JsonParser;
import com.memic.sdk.exception.json.JsonParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link JsonParser} backed by the SDK's snake_case {@link ObjectMapper}.
 */
@Slf4j
@RequiredArgsConstructor
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        return readValue(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        return readValue(jsonBytes, valueType);
    }

    @Override
    public Map<String, Object> parseMap(byte[] jsonBytes) {
        log.trace("Reading {} bytes as a JSON object", jsonBytes.length);
        MapType mapType = objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class,
                                                                         Object.class);
        try {
            return objectMapper.readValue(jsonBytes, mapType);
        } catch (IOException e) {
            log.debug("Cannot read JSON object: {}", e.getMessage());
            throw new JsonParsingException("Cannot read JSON object", e);
        }
    }

    @Override
    public <T> List<T> parseList(byte[] jsonBytes, Class<T> elementType) {
        log.trace("Reading {} bytes as a list of {}", jsonBytes.length, elementType.getSimpleName());
        try {
            JsonNode tree = objectMapper.readTree(jsonBytes);
            if (tree == null || !tree.isArray()) {
                log.debug("Expected a JSON array of {}, got {}", elementType.getSimpleName(),
                          tree == null ? "nothing" : tree.getNodeType());
                return Collections.emptyList();
            }
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
            return objectMapper.convertValue(tree, listType);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot read JSON array of {}", elementType.getSimpleName(), e);
            throw new JsonParsingException("Cannot read JSON array of " + elementType.getSimpleName(), e);
        }
    }

    private <T> T readValue(byte[] jsonBytes, Class<T> valueType) {
        log.trace("Reading {} bytes as {}", jsonBytes.length, valueType.getSimpleName());
        try {
            return objectMapper.readValue(jsonBytes, valueType);
        } catch (IOException e) {
            log.debug("Cannot read JSON as {}: {}", valueType.getSimpleName(), e.getMessage());
            throw new JsonParsingException("Cannot read JSON as " + valueType.getSimpleName(), e);
        }
    }
}
