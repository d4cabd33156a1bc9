package com.memic.sdk.common.apiclient.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

/**
 * The parts of an error payload the client reads to build a human-readable message.
 *
 * @param detail  the {@code detail} field, a string or a structured validation report
 * @param message the {@code message} field
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorBody(@Nullable JsonNode detail, @Nullable JsonNode message) {

    /**
     * @return the first of {@code detail} and {@code message} that is present, rendered as text.
     */
    @Nullable
    public String firstMessage() {
        String fromDetail = asText(detail);
        return fromDetail != null ? fromDetail : asText(message);
    }

    @Nullable
    private static String asText(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
