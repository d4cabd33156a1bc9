package com.memic.sdk.dto.project.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A project as returned by the projects endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectResponse(String id,
                              String name,
                              String organizationId,
                              Boolean isActive,
                              String createdAt,
                              String updatedAt) {
}
