package com.memic.sdk.dto.mapper;

import com.memic.sdk.dto.context.response.ApiKeyContextResponse;
import com.memic.sdk.dto.file.response.FileResponse;
import com.memic.sdk.dto.project.response.ProjectResponse;
import com.memic.sdk.dto.search.response.ResultsPayload;
import com.memic.sdk.dto.search.response.SearchResponse;
import com.memic.sdk.dto.search.response.SearchResultResponse;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.model.ApiKeyContext;
import com.memic.sdk.model.FileStatus;
import com.memic.sdk.model.MemicFile;
import com.memic.sdk.model.Project;
import com.memic.sdk.model.ResultsContainer;
import com.memic.sdk.model.SearchResult;
import com.memic.sdk.model.SearchResults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes raw API responses into the SDK's model, filling in defaults for missing fields.
 */
@Slf4j
public final class MemicResponseMapper {

    private MemicResponseMapper() {
    }

    /**
     * Normalizes a confirm or status response. Missing size and counts become 0, a missing status
     * becomes {@link FileStatus#UPLOADING} and missing strings become empty.
     *
     * @throws ApiException if the response carries a status outside the known pipeline stages
     */
    public static MemicFile toFile(FileResponse response) {
        return MemicFile.builder()
                        .id(orEmpty(response.id()))
                        .name(orEmpty(response.name()))
                        .originalFilename(orEmpty(response.originalFilename()))
                        .size(Optional.ofNullable(response.size()).orElse(0L))
                        .mimeType(orEmpty(response.mimeType()))
                        .projectId(orEmpty(response.projectId()))
                        .status(toStatus(response.status()))
                        .referenceId(response.referenceId())
                        .errorMessage(response.errorMessage())
                        .totalChunks(Optional.ofNullable(response.totalChunks()).orElse(0))
                        .totalEmbeddings(Optional.ofNullable(response.totalEmbeddings()).orElse(0))
                        .createdAt(parseTimestamp(response.createdAt()))
                        .updatedAt(parseTimestamp(response.updatedAt()))
                        .build();
    }

    public static Project toProject(ProjectResponse response) {
        return new Project(orEmpty(response.id()),
                           orEmpty(response.name()),
                           orEmpty(response.organizationId()),
                           !Boolean.FALSE.equals(response.isActive()),
                           parseTimestamp(response.createdAt()),
                           parseTimestamp(response.updatedAt()));
    }

    /**
     * @throws ApiException if the response does not name an organization
     */
    public static ApiKeyContext toApiKeyContext(ApiKeyContextResponse response) {
        if (response == null || !StringUtils.hasText(response.organizationId())) {
            throw new ApiException("API key context response did not include an organization_id", null, null);
        }
        return new ApiKeyContext(response.organizationId(),
                                 response.organizationName(),
                                 response.projectId(),
                                 response.environmentSlug());
    }

    /**
     * Maps a search response. The total defaults to the number of semantic results, the latency to 0
     * and the query to the one that was sent.
     */
    public static SearchResults toSearchResults(SearchResponse response, String requestedQuery) {
        ResultsPayload payload = Optional.ofNullable(response.results()).orElseGet(ResultsPayload::empty);
        List<SearchResult> semantic = Optional.ofNullable(payload.semantic())
                                              .orElseGet(Collections::emptyList)
                                              .stream()
                                              .filter(Objects::nonNull)
                                              .map(MemicResponseMapper::toSearchResult)
                                              .toList();

        return new SearchResults(Optional.ofNullable(response.query()).orElse(requestedQuery),
                                 new ResultsContainer(semantic, payload.structured()),
                                 response.routing(),
                                 Optional.ofNullable(response.totalResults()).orElse(semantic.size()),
                                 Optional.ofNullable(response.searchTimeMs()).orElse(0.0));
    }

    public static SearchResult toSearchResult(SearchResultResponse item) {
        return SearchResult.builder()
                           .chunkId(orEmpty(item.chunkId()))
                           .fileId(orEmpty(item.fileId()))
                           .fileName(orEmpty(item.fileName()))
                           .content(orEmpty(item.content()))
                           .score(Optional.ofNullable(item.score()).orElse(0.0))
                           .chunkIndex(Optional.ofNullable(item.chunkIndex()).orElse(0))
                           .pageNumber(item.pageNumber())
                           .startPage(item.startPage())
                           .endPage(item.endPage())
                           .projectId(StringUtils.hasText(item.projectId()) ? item.projectId() : null)
                           .referenceId(item.referenceId())
                           .category(item.category())
                           .documentType(item.documentType())
                           .boundingBoxes(item.boundingBoxes() == null
                                                  ? null
                                                  : Collections.unmodifiableMap(item.boundingBoxes()))
                           .build();
    }

    private static FileStatus toStatus(@Nullable String value) {
        if (value == null) {
            return FileStatus.UPLOADING;
        }
        try {
            return FileStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ApiException("Unexpected file status returned by the API: " + value, e);
        }
    }

    /**
     * Parses an ISO-8601 timestamp. Timestamps without an offset are read as UTC; unparseable ones
     * are dropped.
     */
    @Nullable
    static Instant parseTimestamp(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.warn("Ignoring unparseable timestamp '{}'", value);
                return null;
            }
        }
    }

    private static String orEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
