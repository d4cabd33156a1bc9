package com.memic.sdk.dto.search.response;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.memic.sdk.model.StructuredResult;

import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads both shapes of {@link ResultsPayload}: a bare array of semantic results, or an object with
 * {@code semantic} and {@code structured} members.
 */
public class ResultsPayloadDeserializer extends StdDeserializer<ResultsPayload> {

    @Serial
    private static final long serialVersionUID = 2190438826531940815L;

    public ResultsPayloadDeserializer() {
        super(ResultsPayload.class);
    }

    @Override
    public ResultsPayload deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || node.isNull()) {
            return ResultsPayload.empty();
        }
        if (node.isArray()) {
            return new ResultsPayload(readSemantic(node, context), null);
        }
        if (node.isObject()) {
            JsonNode structuredNode = node.get("structured");
            StructuredResult structured = structuredNode == null || structuredNode.isNull()
                    ? null
                    : context.readTreeAsValue(structuredNode, StructuredResult.class);
            return new ResultsPayload(readSemantic(node.get("semantic"), context), structured);
        }
        return context.reportInputMismatch(ResultsPayload.class,
                "Expected an array or an object for search results, got %s", node.getNodeType());
    }

    private static List<SearchResultResponse> readSemantic(JsonNode node, DeserializationContext context)
            throws IOException {
        List<SearchResultResponse> semantic = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return semantic;
        }
        for (JsonNode item : node) {
            semantic.add(context.readTreeAsValue(item, SearchResultResponse.class));
        }
        return semantic;
    }
}
