package com.memic.sdk.model;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A file stored in a Memic project, as last reported by the API.
 *
 * @param id               server-assigned file id
 * @param name             display name
 * @param originalFilename name of the uploaded file
 * @param size             size in bytes, 0 when not reported
 * @param mimeType         MIME type
 * @param projectId        owning project
 * @param status           processing stage
 * @param referenceId      caller-supplied reference id, if any
 * @param errorMessage     pipeline error, set when the status is a failure
 * @param totalChunks      number of chunks produced so far
 * @param totalEmbeddings  number of embeddings produced so far
 * @param createdAt        creation time, if reported
 * @param updatedAt        last update time, if reported
 */
@Builder
public record MemicFile(String id,
                        String name,
                        String originalFilename,
                        long size,
                        String mimeType,
                        String projectId,
                        FileStatus status,
                        @Nullable String referenceId,
                        @Nullable String errorMessage,
                        int totalChunks,
                        int totalEmbeddings,
                        @Nullable Instant createdAt,
                        @Nullable Instant updatedAt) {

    public boolean isReady() {
        return status == FileStatus.READY;
    }
}
