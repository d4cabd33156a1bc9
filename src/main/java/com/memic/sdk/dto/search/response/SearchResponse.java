package com.memic.sdk.dto.search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.memic.sdk.model.SearchRouting;

/**
 * Response of the search endpoint. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(String query,
                             ResultsPayload results,
                             SearchRouting routing,
                             Integer totalResults,
                             Double searchTimeMs) {
}
