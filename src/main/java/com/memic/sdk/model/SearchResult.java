package com.memic.sdk.model;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A document chunk matching a search query.
 */
@Builder
public record SearchResult(String chunkId,
                           String fileId,
                           String fileName,
                           String content,
                           double score,
                           int chunkIndex,
                           @Nullable Integer pageNumber,
                           @Nullable Integer startPage,
                           @Nullable Integer endPage,
                           @Nullable String projectId,
                           @Nullable String referenceId,
                           @Nullable String category,
                           @Nullable String documentType,
                           @Nullable Map<String, Object> boundingBoxes) {
}
