package com.memic.sdk.common.apiclient.memic;

import com.memic.sdk.common.apiclient.ApiClient;
import com.memic.sdk.common.apiclient.authentication.Authentication;
import com.memic.sdk.common.apiclient.model.ApiRequest;
import com.memic.sdk.common.apiclient.model.ApiResponse;
import com.memic.sdk.common.apiclient.model.HeaderConfig;
import com.memic.sdk.common.json.JsonParser;
import com.memic.sdk.config.MemicClientProperties;
import com.memic.sdk.dto.context.response.ApiKeyContextResponse;
import com.memic.sdk.dto.file.response.FileResponse;
import com.memic.sdk.dto.mapper.MemicResponseMapper;
import com.memic.sdk.dto.project.response.ProjectResponse;
import com.memic.sdk.dto.search.request.SearchRequest;
import com.memic.sdk.dto.search.response.SearchResponse;
import com.memic.sdk.dto.upload.request.InitUploadRequest;
import com.memic.sdk.dto.upload.response.InitUploadResponse;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.exception.json.JsonParsingException;
import com.memic.sdk.model.ApiKeyContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the Memic REST API.
 *
 * <p>Organization-scoped routes need the organization of the API key. It is fetched from the "me"
 * endpoint the first time such a route is called, or when {@link #apiKeyContext()} is first read,
 * and cached for the lifetime of this instance.
 */
@Slf4j
public class MemicApiClient extends ApiClient {

    private static final String ORGANIZATION_ID = "organizationId";
    private static final String PROJECT_ID = "projectId";
    private static final String FILE_ID = "fileId";
    private static final byte[] EMPTY_OBJECT = "{}".getBytes(StandardCharsets.UTF_8);

    private final MemicClientProperties.Endpoints endpoints;
    private final LazyApiKeyContext apiKeyContext;

    /**
     * Constructs a new MemicApiClient.
     *
     * @param webClient      The WebClient bound to the Memic base URL.
     * @param authentication The API key authentication.
     * @param headerConfig   The fixed headers for API requests.
     * @param jsonParser     The JSON parser for decoding responses.
     * @param properties     Timeout and route configuration.
     */
    public MemicApiClient(WebClient webClient, Authentication authentication, HeaderConfig headerConfig,
                          JsonParser jsonParser, MemicClientProperties properties) {
        super(webClient, authentication, headerConfig, jsonParser, properties.getTimeout());
        this.endpoints = properties.getEndpoints();
        this.apiKeyContext = new LazyApiKeyContext(this::fetchApiKeyContext);
    }

    /**
     * @return what the API key belongs to, fetched on first access
     */
    public ApiKeyContext apiKeyContext() {
        return apiKeyContext.get();
    }

    public String organizationId() {
        return apiKeyContext().organizationId();
    }

    public boolean isApiKeyContextResolved() {
        return apiKeyContext.isResolved();
    }

    /**
     * Issues a request to an arbitrary API path and decodes the JSON object it returns.
     *
     * @param method      HTTP method
     * @param path        path relative to the base URL
     * @param body        JSON body, or {@code null}
     * @param queryParams query parameters, or {@code null}
     *
     * @return the decoded object; empty for 204 responses
     */
    public Map<String, Object> request(HttpMethod method, String path, @Nullable Object body,
                                       @Nullable Map<String, Object> queryParams) {
        ApiRequest apiRequest = ApiRequest.builder()
                                          .method(method)
                                          .path(path)
                                          .queryParams(queryParams)
                                          .body(body)
                                          .acceptMediaType(MediaType.APPLICATION_JSON)
                                          .build();
        ApiResponse apiResponse = call(apiRequest);
        try {
            return jsonParser.parseMap(apiResponse.hasBody() ? apiResponse.getData() : EMPTY_OBJECT);
        } catch (JsonParsingException e) {
            throw new ApiException("Invalid JSON returned by " + path, e);
        }
    }

    public List<ProjectResponse> listProjects() {
        ApiRequest apiRequest = get(endpoints.getProjects(), scopedVariables(endpoints.getProjects(), Map.of()));
        ApiResponse apiResponse = call(apiRequest);
        try {
            return jsonParser.parseList(apiResponse.getData(), ProjectResponse.class);
        } catch (JsonParsingException e) {
            throw new ApiException("Invalid JSON returned by " + endpoints.getProjects(), e);
        }
    }

    public InitUploadResponse initUpload(String projectId, InitUploadRequest request) {
        log.info("Initializing upload of '{}' ({} bytes) in project {}", request.filename(), request.size(),
                 projectId);
        ApiRequest apiRequest = post(endpoints.getInitUpload(), Map.of(PROJECT_ID, projectId), request);
        InitUploadResponse response = decode(call(apiRequest), InitUploadResponse.class, endpoints.getInitUpload());
        if (response.fileId() == null || response.uploadUrl() == null) {
            throw new ApiException("Upload init response did not include file_id and upload_url", null, null);
        }
        return response;
    }

    public FileResponse confirmUpload(String projectId, String fileId) {
        log.info("Confirming upload of file {} in project {}", fileId, projectId);
        ApiRequest apiRequest = post(endpoints.getConfirmUpload(), Map.of(PROJECT_ID, projectId, FILE_ID, fileId),
                                     null);
        return decode(call(apiRequest), FileResponse.class, endpoints.getConfirmUpload());
    }

    public FileResponse getFileStatus(String projectId, String fileId) {
        ApiRequest apiRequest = get(endpoints.getFileStatus(), Map.of(PROJECT_ID, projectId, FILE_ID, fileId));
        return decode(call(apiRequest), FileResponse.class, endpoints.getFileStatus());
    }

    public void deleteFile(String projectId, String fileId) {
        log.info("Deleting file {} from project {}", fileId, projectId);
        call(ApiRequest.builder()
                       .method(HttpMethod.DELETE)
                       .path(endpoints.getDeleteFile())
                       .pathVariables(Map.of(PROJECT_ID, projectId, FILE_ID, fileId))
                       .build());
    }

    public SearchResponse search(SearchRequest request) {
        ApiRequest apiRequest = post(endpoints.getSearch(), scopedVariables(endpoints.getSearch(), Map.of()), request);
        return decode(call(apiRequest), SearchResponse.class, endpoints.getSearch());
    }

    private ApiKeyContext fetchApiKeyContext() {
        log.debug("Resolving API key context from {}", endpoints.getMe());
        ApiResponse apiResponse = call(get(endpoints.getMe(), Map.of()));
        ApiKeyContextResponse response = decode(apiResponse, ApiKeyContextResponse.class, endpoints.getMe());
        return MemicResponseMapper.toApiKeyContext(response);
    }

    /**
     * Adds the organization id to the path variables, resolving it only when the template uses it.
     */
    private Map<String, Object> scopedVariables(String pathTemplate, Map<String, Object> variables) {
        if (!pathTemplate.contains("{" + ORGANIZATION_ID + "}")) {
            return variables;
        }
        Map<String, Object> scoped = new HashMap<>(variables);
        scoped.put(ORGANIZATION_ID, organizationId());
        return scoped;
    }

    private <T> T decode(ApiResponse apiResponse, Class<T> type, String path) {
        byte[] data = apiResponse.hasBody() ? apiResponse.getData() : EMPTY_OBJECT;
        try {
            return jsonParser.parseObject(data, type);
        } catch (JsonParsingException e) {
            throw new ApiException("Invalid JSON returned by " + path, e);
        }
    }

    private static ApiRequest get(String path, Map<String, Object> pathVariables) {
        return ApiRequest.builder()
                         .method(HttpMethod.GET)
                         .path(path)
                         .pathVariables(pathVariables)
                         .acceptMediaType(MediaType.APPLICATION_JSON)
                         .build();
    }

    private static ApiRequest post(String path, Map<String, Object> pathVariables, @Nullable Object body) {
        return ApiRequest.builder()
                         .method(HttpMethod.POST)
                         .path(path)
                         .pathVariables(pathVariables)
                         .body(body)
                         .contentType(MediaType.APPLICATION_JSON)
                         .acceptMediaType(MediaType.APPLICATION_JSON)
                         .build();
    }
}
