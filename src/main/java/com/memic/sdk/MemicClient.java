package com.memic.sdk;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.config.MemicClientAutoConfiguration;
import com.memic.sdk.config.MemicClientProperties;
import com.memic.sdk.dto.search.SearchParameters;
import com.memic.sdk.dto.upload.FileUploadParameters;
import com.memic.sdk.exception.apiclient.AuthenticationException;
import com.memic.sdk.model.ApiKeyContext;
import com.memic.sdk.model.MemicFile;
import com.memic.sdk.model.Project;
import com.memic.sdk.model.SearchResults;
import com.memic.sdk.service.file.FileStatusService;
import com.memic.sdk.service.project.ProjectService;
import com.memic.sdk.service.search.SearchService;
import com.memic.sdk.service.upload.FileUploadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Entry point of the Memic SDK: uploads files, tracks their processing and searches them.
 *
 * <p>Inside a Spring Boot application the client is an auto-configured bean. Elsewhere, use
 * {@link #fromEnvironment()}, {@link #withApiKey(String)} or {@link #create(MemicClientProperties)}:
 *
 * <pre>{@code
 * MemicClient client = MemicClient.withApiKey("mk_...");
 * MemicFile file = client.uploadFile(FileUploadParameters.builder()
 *         .filePath(Path.of("report.pdf"))
 *         .projectId(projectId)
 *         .build());
 * SearchResults results = client.search(SearchParameters.of("quarterly revenue"));
 * }</pre>
 *
 * <p>Instances are safe to share between threads. All calls block until the server has answered.
 */
@Slf4j
public class MemicClient {

    private final MemicApiClient apiClient;
    private final ProjectService projectService;
    private final FileUploadService fileUploadService;
    private final FileStatusService fileStatusService;
    private final SearchService searchService;

    public MemicClient(MemicApiClient apiClient, ProjectService projectService, FileUploadService fileUploadService,
                       FileStatusService fileStatusService, SearchService searchService) {
        this.apiClient = apiClient;
        this.projectService = projectService;
        this.fileUploadService = fileUploadService;
        this.fileStatusService = fileStatusService;
        this.searchService = searchService;
    }

    /**
     * Creates a client from explicit properties, without a Spring context.
     *
     * @throws AuthenticationException if the properties carry no API key
     */
    public static MemicClient create(MemicClientProperties properties) {
        MemicClientAutoConfiguration configuration = new MemicClientAutoConfiguration();
        MemicApiClient apiClient = configuration.memicApiClient(configuration.memicWebClient(properties),
                                                                configuration.memicAuthentication(properties),
                                                                configuration.memicHeader(properties),
                                                                configuration.memicJsonParser(),
                                                                properties);
        WebClient storageWebClient = configuration.memicStorageWebClient();
        FileStatusService fileStatusService = configuration.fileStatusService(apiClient, properties,
                                                                              configuration.memicPollSleeper(),
                                                                              configuration.memicClock());
        FileUploadService fileUploadService = configuration.fileUploadService(
                apiClient, configuration.presignedUploadClient(storageWebClient, properties), fileStatusService);

        log.debug("Created Memic client for {}", properties.normalizedBaseUrl());
        return configuration.memicClient(apiClient, configuration.projectService(apiClient), fileUploadService,
                                         fileStatusService, configuration.searchService(apiClient));
    }

    /**
     * Creates a client from the {@code MEMIC_API_KEY} and {@code MEMIC_BASE_URL} environment variables.
     *
     * @throws AuthenticationException if {@code MEMIC_API_KEY} is not set
     */
    public static MemicClient fromEnvironment() {
        return create(MemicClientProperties.fromEnvironment(System::getenv));
    }

    /**
     * Creates a client with the given API key. The base URL still honours {@code MEMIC_BASE_URL}.
     */
    public static MemicClient withApiKey(String apiKey) {
        MemicClientProperties properties = MemicClientProperties.fromEnvironment(System::getenv);
        properties.setApiKey(apiKey);
        return create(properties);
    }

    /**
     * @return the organization, project and environment the API key belongs to
     */
    public ApiKeyContext apiKeyContext() {
        return apiClient.apiKeyContext();
    }

    public String organizationId() {
        return apiClient.organizationId();
    }

    public List<Project> listProjects() {
        return projectService.listProjects();
    }

    public MemicFile uploadFile(FileUploadParameters parameters) {
        return fileUploadService.uploadFile(parameters);
    }

    public MemicFile getFileStatus(String projectId, String fileId) {
        return fileStatusService.getFileStatus(projectId, fileId);
    }

    public MemicFile waitForReady(String projectId, String fileId) {
        return fileStatusService.waitForReady(projectId, fileId);
    }

    public MemicFile waitForReady(String projectId, String fileId, Duration pollInterval, Duration pollTimeout) {
        return fileStatusService.waitForReady(projectId, fileId, pollInterval, pollTimeout);
    }

    public void deleteFile(String projectId, String fileId) {
        fileStatusService.deleteFile(projectId, fileId);
    }

    public SearchResults search(SearchParameters parameters) {
        return searchService.search(parameters);
    }

    public SearchResults search(String query) {
        return search(SearchParameters.of(query));
    }
}
