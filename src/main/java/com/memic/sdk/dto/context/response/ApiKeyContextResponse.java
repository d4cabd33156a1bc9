package com.memic.sdk.dto.context.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the "me" endpoint describing what the API key belongs to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiKeyContextResponse(String organizationId,
                                    String organizationName,
                                    String projectId,
                                    String environmentSlug) {
}
