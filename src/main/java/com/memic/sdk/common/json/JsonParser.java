package com.memic.sdk.common.json;

import java.util.List;
import java.util.Map;

/**
 * Decodes API payloads. Implementations report malformed input as
 * {@link com.memic.sdk.exception.json.JsonParsingException}.
 */
public interface JsonParser {

    <T> T parseObject(String json, Class<T> valueType);

    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON object into an ordered map of its members.
     */
    Map<String, Object> parseMap(byte[] jsonBytes);

    /**
     * Parses a JSON array into a list of objects of the specified element type. A well-formed payload
     * that is not a JSON array yields an empty list.
     *
     * @param jsonBytes   The JSON data as a byte array.
     * @param elementType The class of the list elements.
     * @param <T>         The element type.
     *
     * @return The parsed list, never {@code null}.
     *
     * @throws com.memic.sdk.exception.json.JsonParsingException if the payload is not valid JSON or
     *                                                           an element cannot be mapped.
     */
    <T> List<T> parseList(byte[] jsonBytes, Class<T> elementType);
}
