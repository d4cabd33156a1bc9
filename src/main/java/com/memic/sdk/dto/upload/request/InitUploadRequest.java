package com.memic.sdk.dto.upload.request;

import java.util.Map;

/**
 * Request body of the upload init endpoint. Null fields are left out of the payload.
 *
 * @param filename    name of the local file
 * @param size        size in bytes
 * @param mimeType    MIME type sent again as the storage PUT content type
 * @param referenceId optional caller-supplied reference id
 * @param metadata    optional metadata key-value pairs
 */
public record InitUploadRequest(String filename,
                                long size,
                                String mimeType,
                                String referenceId,
                                Map<String, Object> metadata) {
}
