package com.memic.sdk.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Semantic and structured results of one search. Either, both or neither may be populated.
 */
public record ResultsContainer(List<SearchResult> semantic, @Nullable StructuredResult structured) {

    public ResultsContainer {
        semantic = semantic == null ? List.of() : List.copyOf(semantic);
    }

    public static ResultsContainer empty() {
        return new ResultsContainer(List.of(), null);
    }
}
