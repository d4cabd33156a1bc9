package com.memic.sdk.dto.search.request;

import java.util.List;
import java.util.Map;

/**
 * Request body of the search endpoint. Null fields are left out of the payload.
 */
public record SearchRequest(String query,
                            int topK,
                            double minScore,
                            String projectId,
                            List<String> fileIds,
                            Map<String, Object> metadataFilters) {
}
