package com.memic.sdk.common.apiclient.memic;

import com.memic.sdk.config.MemicClientProperties;
import com.memic.sdk.dto.file.response.FileResponse;
import com.memic.sdk.dto.project.response.ProjectResponse;
import com.memic.sdk.dto.upload.request.InitUploadRequest;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.exception.apiclient.AuthenticationException;
import com.memic.sdk.exception.apiclient.ConnectionException;
import com.memic.sdk.exception.apiclient.NotFoundException;
import com.memic.sdk.exception.apiclient.RequestTimeoutException;
import com.memic.sdk.support.MemicTestClients;
import com.memic.sdk.support.RecordingExchangeFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemicApiClientTest {

    private static final String ME = "{\"organization_id\":\"org-1\",\"organization_name\":\"Acme\"}";

    private RecordingExchangeFunction exchange;
    private MemicApiClient apiClient;

    @BeforeEach
    void setUp() {
        exchange = new RecordingExchangeFunction();
        apiClient = MemicTestClients.apiClient(exchange);
    }

    @Nested
    @DisplayName("request headers")
    class RequestHeaders {

        @Test
        void everyRequestCarriesApiKeyUserAgentAndJsonContentType() {
            exchange.respondEmpty(HttpStatus.NO_CONTENT);

            apiClient.deleteFile("p1", "f1");

            HttpHeaders headers = exchange.request(0).headers();
            assertThat(headers.getFirst("X-API-Key")).isEqualTo(MemicTestClients.API_KEY);
            assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).startsWith("memic-java/");
            assertThat(headers.getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/json");
            assertThat(exchange.request(0).method()).isEqualTo(HttpMethod.DELETE);
            assertThat(exchange.request(0).url())
                    .isEqualTo(URI.create(MemicTestClients.BASE_URL + "/projects/p1/files/f1"));
        }
    }

    @Nested
    @DisplayName("error mapping")
    class ErrorMapping {

        @Test
        void unauthorizedUsesTheDetailField() {
            exchange.respond(HttpStatus.UNAUTHORIZED, "{\"detail\":\"Invalid API key\"}");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Invalid API key")
                    .extracting(e -> ((ApiException) e).getStatusCode())
                    .isEqualTo(401);
        }

        @Test
        void forbiddenIsAnAuthenticationError() {
            exchange.respond(HttpStatus.FORBIDDEN, "{\"message\":\"Project not in scope\"}");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessage("Project not in scope");
        }

        @Test
        void notFoundKeepsTheBody() {
            exchange.respond(HttpStatus.NOT_FOUND, "{\"detail\":\"File not found\"}");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "missing"))
                    .isInstanceOfSatisfying(NotFoundException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(404);
                        assertThat(e.getResponseBody()).contains("File not found");
                    });
        }

        @Test
        void serverErrorFallsBackToRawBody() {
            exchange.respondText(HttpStatus.INTERNAL_SERVER_ERROR, "upstream exploded");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOfSatisfying(ApiException.class, e -> {
                        assertThat(e).isNotInstanceOf(AuthenticationException.class);
                        assertThat(e.getMessage()).isEqualTo("upstream exploded");
                        assertThat(e.getStatusCode()).isEqualTo(500);
                        assertThat(e.getResponseBody()).isEqualTo("upstream exploded");
                    });
        }

        @Test
        void emptyErrorBodyFallsBackToStatus() {
            exchange.respondEmpty(HttpStatus.BAD_GATEWAY);

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(ApiException.class)
                    .hasMessage("HTTP 502");
        }

        @Test
        void structuredDetailIsRenderedAsJson() {
            exchange.respond(HttpStatus.UNPROCESSABLE_ENTITY, "{\"detail\":[{\"loc\":[\"body\",\"size\"]}]}");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(ApiException.class)
                    .hasMessageContaining("\"loc\"");
        }

        @Test
        void connectivityFailureBecomesConnectionException() {
            exchange.fail(new WebClientRequestException(new ConnectException("Connection refused"), HttpMethod.GET,
                                                        URI.create(MemicTestClients.BASE_URL), new HttpHeaders()));

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageStartingWith("Request failed:")
                    .extracting(e -> ((ApiException) e).getStatusCode())
                    .isNull();
        }

        @Test
        void unansweredRequestTimesOut() {
            MemicClientProperties properties = MemicTestClients.properties();
            properties.setTimeout(Duration.ofMillis(200));
            MemicApiClient impatient = MemicTestClients.apiClient(exchange, properties);
            exchange.hang();

            assertThatThrownBy(() -> impatient.getFileStatus("p1", "f1"))
                    .isInstanceOf(RequestTimeoutException.class)
                    .hasMessage("Request timed out after 200 ms")
                    .extracting(e -> ((ApiException) e).getStatusCode())
                    .isNull();
        }

        @Test
        void invalidJsonOnSuccessIsAnApiError() {
            exchange.respondText(HttpStatus.OK, "<html>gateway</html>");

            assertThatThrownBy(() -> apiClient.getFileStatus("p1", "f1"))
                    .isInstanceOf(ApiException.class)
                    .hasMessageContaining("Invalid JSON");
        }
    }

    @Nested
    @DisplayName("API key context")
    class ApiKeyContextResolution {

        @Test
        void contextIsResolvedOnceAndReused() {
            exchange.respond(HttpStatus.OK, ME)
                    .respond(HttpStatus.OK, "[]")
                    .respond(HttpStatus.OK, "[]");

            assertThat(apiClient.isApiKeyContextResolved()).isFalse();
            apiClient.listProjects();
            apiClient.listProjects();

            assertThat(apiClient.isApiKeyContextResolved()).isTrue();
            assertThat(apiClient.organizationId()).isEqualTo("org-1");
            assertThat(exchange.requests()).extracting(RecordingExchangeFunction.RecordedRequest::path)
                                           .containsExactly("/api-keys/me", "/organizations/org-1/projects/",
                                                            "/organizations/org-1/projects/");
        }

        @Test
        void projectScopedRoutesDoNotResolveTheContext() {
            exchange.respond(HttpStatus.OK, "{\"id\":\"f1\",\"status\":\"ready\"}");

            apiClient.getFileStatus("p1", "f1");

            assertThat(apiClient.isApiKeyContextResolved()).isFalse();
            assertThat(exchange.requestCount()).isEqualTo(1);
        }

        @Test
        void failedResolutionIsRetriedOnNextAccess() {
            exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"detail\":\"down\"}")
                    .respond(HttpStatus.OK, ME);

            assertThatThrownBy(apiClient::apiKeyContext).isInstanceOf(ApiException.class);
            assertThat(apiClient.apiKeyContext().organizationName()).isEqualTo("Acme");
        }
    }

    @Nested
    @DisplayName("endpoints")
    class Endpoints {

        @Test
        void listProjectsMapsSnakeCaseFields() {
            exchange.respond(HttpStatus.OK, ME)
                    .respond(HttpStatus.OK, "[{\"id\":\"p1\",\"name\":\"Docs\",\"organization_id\":\"org-1\","
                            + "\"is_active\":false}]");

            List<ProjectResponse> projects = apiClient.listProjects();

            assertThat(projects).containsExactly(new ProjectResponse("p1", "Docs", "org-1", false, null, null));
        }

        @Test
        void sdkLayoutSkipsTheContextLookup() {
            MemicClientProperties properties = MemicTestClients.properties();
            properties.setEndpoints(MemicClientProperties.Endpoints.sdkLayout());
            MemicApiClient sdkClient = MemicTestClients.apiClient(exchange, properties);
            exchange.respond(HttpStatus.OK, "[]")
                    .respond(HttpStatus.OK, "{\"id\":\"f1\",\"status\":\"parsing_started\"}");

            sdkClient.listProjects();
            sdkClient.getFileStatus("p1", "f1");

            assertThat(exchange.requests()).extracting(RecordingExchangeFunction.RecordedRequest::path)
                                           .containsExactly("/sdk/projects", "/sdk/files/f1/status");
        }

        @Test
        void genericRequestDecodesObjectsAndSendsQueryParameters() {
            exchange.respond(HttpStatus.OK, "{\"ok\":true}");

            Map<String, Object> result = apiClient.request(HttpMethod.GET, "/health", null, Map.of("verbose", 1));

            assertThat(result).containsEntry("ok", true);
            assertThat(exchange.request(0).url().getQuery()).isEqualTo("verbose=1");
        }

        @Test
        void redirectStatusesBelow400AreDecodedNotRaised() {
            exchange.respond(HttpStatus.NOT_MODIFIED, "{\"a\":1}")
                    .respondEmpty(HttpStatus.TEMPORARY_REDIRECT);

            assertThat(apiClient.request(HttpMethod.GET, "/x", null, null)).containsEntry("a", 1);
            assertThat(apiClient.request(HttpMethod.POST, "/organizations/org-1/search", null, null)).isEmpty();
        }

        @Test
        void numericIdentifiersAreReadAsStrings() {
            exchange.respond(HttpStatus.OK, "{\"id\":123,\"project_id\":456,\"status\":\"uploaded\"}")
                    .respond(HttpStatus.OK, "{\"organization_id\":77}")
                    .respond(HttpStatus.OK, "[]");

            FileResponse file = apiClient.getFileStatus("p1", "f1");
            apiClient.listProjects();

            assertThat(file.id()).isEqualTo("123");
            assertThat(file.projectId()).isEqualTo("456");
            assertThat(apiClient.organizationId()).isEqualTo("77");
            assertThat(exchange.request(2).path()).isEqualTo("/organizations/77/projects/");
        }

        @Test
        void noContentDecodesToAnEmptyObject() {
            exchange.respondEmpty(HttpStatus.NO_CONTENT);

            assertThat(apiClient.request(HttpMethod.DELETE, "/projects/p1", null, null)).isEmpty();
        }

        @Test
        void initUploadRequiresFileIdAndUploadUrl() {
            exchange.respond(HttpStatus.OK, "{\"file_id\":\"f1\"}");

            assertThatThrownBy(() -> apiClient.initUpload("p1", new InitUploadRequest("a.pdf", 3, "application/pdf",
                                                                                 null, null)))
                    .isInstanceOf(ApiException.class)
                    .hasMessageContaining("upload_url");
        }
    }
}
