package com.memic.sdk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Binds application properties under the "memic" prefix to a strongly-typed configuration object.
 *
 * <p>Relaxed binding maps the {@code MEMIC_API_KEY} and {@code MEMIC_BASE_URL} environment variables
 * onto {@link #apiKey} and {@link #baseUrl}. Outside a Spring context,
 * {@link #fromEnvironment(UnaryOperator)} does the same lookup.
 */
@Data
@ConfigurationProperties(prefix = "memic")
public class MemicClientProperties {

    public static final String DEFAULT_BASE_URL = "https://app.memic.ai";
    public static final String API_KEY_ENV = "MEMIC_API_KEY";
    public static final String BASE_URL_ENV = "MEMIC_BASE_URL";

    private String apiKey;
    private String baseUrl = DEFAULT_BASE_URL;
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Storage uploads get {@code timeout * uploadTimeoutMultiplier}.
     */
    private int uploadTimeoutMultiplier = 10;

    private String apiKeyHeader = "X-API-Key";
    private String userAgent = "memic-java/" + SdkVersion.get();
    private Polling polling = new Polling();
    private Endpoints endpoints = new Endpoints();

    /**
     * Reads the API key and base URL from environment variables.
     *
     * @param environment variable lookup, {@code System::getenv} in production
     *
     * @return properties with defaults for everything else
     */
    public static MemicClientProperties fromEnvironment(UnaryOperator<String> environment) {
        MemicClientProperties properties = new MemicClientProperties();
        properties.setApiKey(environment.apply(API_KEY_ENV));
        String baseUrl = environment.apply(BASE_URL_ENV);
        if (StringUtils.hasText(baseUrl)) {
            properties.setBaseUrl(baseUrl);
        }
        return properties;
    }

    /**
     * @return the base URL without trailing slashes
     */
    public String normalizedBaseUrl() {
        String url = StringUtils.hasText(baseUrl) ? baseUrl.trim() : DEFAULT_BASE_URL;
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public Duration uploadTimeout() {
        return timeout.multipliedBy(Math.max(1, uploadTimeoutMultiplier));
    }

    @Data
    public static class Polling {
        private Duration interval = Duration.ofSeconds(2);
        private Duration timeout = Duration.ofSeconds(300);
    }

    /**
     * Route templates relative to the base URL. {@code {organizationId}}, {@code {projectId}} and
     * {@code {fileId}} are expanded per call; templates may leave any of them out.
     */
    @Data
    public static class Endpoints {
        private String me = "/api-keys/me";
        private String projects = "/organizations/{organizationId}/projects/";
        private String initUpload = "/projects/{projectId}/files/init";
        private String confirmUpload = "/projects/{projectId}/files/{fileId}/confirm";
        private String fileStatus = "/projects/{projectId}/files/{fileId}/status";
        private String deleteFile = "/projects/{projectId}/files/{fileId}";
        private String search = "/organizations/{organizationId}/search/";

        /**
         * The project-scoped route layout served under {@code /sdk}, where the API key determines the
         * organization and project.
         */
        public static Endpoints sdkLayout() {
            Endpoints endpoints = new Endpoints();
            endpoints.setMe("/sdk/me");
            endpoints.setProjects("/sdk/projects");
            endpoints.setInitUpload("/sdk/files/init");
            endpoints.setConfirmUpload("/sdk/files/{fileId}/confirm");
            endpoints.setFileStatus("/sdk/files/{fileId}/status");
            endpoints.setDeleteFile("/sdk/files/{fileId}");
            endpoints.setSearch("/sdk/search");
            return endpoints;
        }
    }
}
