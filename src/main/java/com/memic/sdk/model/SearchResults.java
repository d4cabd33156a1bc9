package com.memic.sdk.model;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a search: the matching document chunks, an optional table from a structured query,
 * and how the service routed the query.
 *
 * <p>Size and indexed access refer to the semantic results. The client never truncates what the
 * server returned.
 *
 * @param query        the query as echoed by the server
 * @param results      semantic and structured results
 * @param routing      routing decision, if reported
 * @param totalResults total number of results reported by the server
 * @param searchTimeMs server-side search latency in milliseconds
 */
public record SearchResults(String query,
                            ResultsContainer results,
                            @Nullable SearchRouting routing,
                            int totalResults,
                            double searchTimeMs) {

    public SearchResults {
        results = results == null ? ResultsContainer.empty() : results;
    }

    public List<SearchResult> semantic() {
        return results.semantic();
    }

    public Optional<StructuredResult> structured() {
        return Optional.ofNullable(results.structured());
    }

    public Optional<SearchRouting> routingInfo() {
        return Optional.ofNullable(routing);
    }

    public int size() {
        return results.semantic().size();
    }

    public SearchResult get(int index) {
        return results.semantic().get(index);
    }

    public boolean hasDocuments() {
        return !results.semantic().isEmpty();
    }

    public boolean hasStructured() {
        return results.structured() != null && results.structured().hasData();
    }
}
