package com.memic.sdk.service.search;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.dto.mapper.MemicResponseMapper;
import com.memic.sdk.dto.search.SearchParameters;
import com.memic.sdk.dto.search.request.SearchRequest;
import com.memic.sdk.dto.search.response.SearchResponse;
import com.memic.sdk.model.MetadataFilters;
import com.memic.sdk.model.SearchResults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Runs searches across the documents of the organization.
 */
@Slf4j
@RequiredArgsConstructor
public class SearchService {

    private final MemicApiClient apiClient;

    /**
     * Sends one search request and maps the semantic and structured results it returns. Results are
     * returned as the server sent them, without local truncation or re-ranking.
     */
    public SearchResults search(SearchParameters parameters) {
        SearchRequest request = toRequest(parameters);
        log.debug("Searching with top_k={}, min_score={}, filters={}", request.topK(), request.minScore(),
                  request.metadataFilters());

        SearchResponse response = apiClient.search(request);
        SearchResults results = MemicResponseMapper.toSearchResults(response, parameters.getQuery());
        log.info("Search returned {} semantic results{} in {} ms", results.size(),
                 results.hasStructured() ? " and " + results.structured().map(s -> s.size()).orElse(0) + " rows" : "",
                 results.searchTimeMs());
        return results;
    }

    static SearchRequest toRequest(SearchParameters parameters) {
        String projectId = StringUtils.hasText(parameters.getProjectId()) ? parameters.getProjectId() : null;
        List<String> fileIds = CollectionUtils.isEmpty(parameters.getFileIds()) ? null : parameters.getFileIds();
        MetadataFilters filters = parameters.getFilters();
        Map<String, Object> metadataFilters = filters == null || filters.isEmpty() ? null : filters.toApiFormat();

        return new SearchRequest(parameters.getQuery(), parameters.getTopK(), parameters.getMinScore(), projectId,
                                 fileIds, metadataFilters);
    }
}
