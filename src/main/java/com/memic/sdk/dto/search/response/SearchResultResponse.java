package com.memic.sdk.dto.search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * A single semantic result item. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResultResponse(String chunkId,
                                   String fileId,
                                   String fileName,
                                   String content,
                                   Double score,
                                   Integer chunkIndex,
                                   Integer pageNumber,
                                   Integer startPage,
                                   Integer endPage,
                                   String projectId,
                                   String referenceId,
                                   String category,
                                   String documentType,
                                   Map<String, Object> boundingBoxes) {
}
