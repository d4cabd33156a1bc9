package com.memic.sdk.dto.search.response;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.memic.sdk.model.StructuredResult;

import java.util.List;

/**
 * The {@code results} member of a search response.
 *
 * <p>Older deployments send a plain list of semantic results; newer ones send an object with a
 * {@code semantic} list and an optional {@code structured} table. Both shapes deserialize into this
 * record.
 */
@JsonDeserialize(using = ResultsPayloadDeserializer.class)
public record ResultsPayload(List<SearchResultResponse> semantic, StructuredResult structured) {

    public static ResultsPayload empty() {
        return new ResultsPayload(List.of(), null);
    }
}
