package com.memic.sdk.dto.file.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A file as returned by the confirm and status endpoints. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileResponse(String id,
                           String name,
                           String originalFilename,
                           Long size,
                           String mimeType,
                           String projectId,
                           String status,
                           String referenceId,
                           String errorMessage,
                           Integer totalChunks,
                           Integer totalEmbeddings,
                           String createdAt,
                           String updatedAt) {
}
