package com.memic.sdk.dto.upload.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the upload init endpoint.
 *
 * @param fileId    server-assigned id of the file being uploaded
 * @param uploadUrl presigned URL accepting a single PUT of the file bytes
 * @param expiresIn lifetime of the presigned URL in seconds, if reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InitUploadResponse(String fileId, String uploadUrl, Long expiresIn) {
}
