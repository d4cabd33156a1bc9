package com.memic.sdk.service.upload;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.config.MemicClientProperties;
import com.memic.sdk.dto.upload.FileUploadParameters;
import com.memic.sdk.exception.LocalFileNotFoundException;
import com.memic.sdk.exception.apiclient.ApiException;
import com.memic.sdk.model.FileStatus;
import com.memic.sdk.model.MemicFile;
import com.memic.sdk.service.file.FileStatusService;
import com.memic.sdk.support.MemicTestClients;
import com.memic.sdk.support.MutableClock;
import com.memic.sdk.support.RecordingExchangeFunction;
import com.memic.sdk.support.RecordingExchangeFunction.RecordedRequest;
import com.memic.sdk.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileUploadServiceTest {

    private static final String UPLOAD_URL = "https://storage.test/bucket/f1?X-Signature=abc%2Fdef";
    private static final String INIT = "{\"file_id\":\"f1\",\"upload_url\":\"" + UPLOAD_URL + "\",\"expires_in\":3600}";
    private static final String CONFIRMED = "{\"id\":\"f1\",\"name\":\"notes.txt\",\"size\":11,\"project_id\":\"p1\","
            + "\"status\":\"uploaded\"}";

    @TempDir
    Path tempDir;

    private RecordingExchangeFunction api;
    private RecordingExchangeFunction storage;
    private RecordingSleeper sleeper;
    private FileUploadService uploadService;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        api = new RecordingExchangeFunction();
        storage = new RecordingExchangeFunction();
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        sleeper = new RecordingSleeper(clock);

        MemicApiClient apiClient = MemicTestClients.apiClient(api);
        FileStatusService statusService = new FileStatusService(apiClient, new MemicClientProperties.Polling(),
                                                                sleeper, clock);
        uploadService = new FileUploadService(apiClient, MemicTestClients.storageClient(storage), statusService);

        file = Files.writeString(tempDir.resolve("notes.txt"), "hello world", StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void missingFileFailsBeforeAnyRequest() {
            FileUploadParameters parameters = FileUploadParameters.builder()
                                                                  .filePath(tempDir.resolve("absent.pdf"))
                                                                  .projectId("p1")
                                                                  .build();

            assertThatThrownBy(() -> uploadService.uploadFile(parameters))
                    .isInstanceOf(LocalFileNotFoundException.class)
                    .hasMessageContaining("absent.pdf");
            assertThat(api.requestCount()).isZero();
            assertThat(storage.requestCount()).isZero();
        }

        @Test
        void directoryIsNotAnUploadableFile() {
            FileUploadParameters parameters = FileUploadParameters.builder().filePath(tempDir).projectId("p1").build();

            assertThatThrownBy(() -> uploadService.uploadFile(parameters))
                    .isInstanceOf(LocalFileNotFoundException.class);
            assertThat(api.requestCount()).isZero();
        }

        @Test
        void projectIsRequiredWhenTheKeyIsNotProjectScoped() {
            api.respond(HttpStatus.OK, "{\"organization_id\":\"org-1\"}");
            FileUploadParameters parameters = FileUploadParameters.builder().filePath(file).build();

            assertThatThrownBy(() -> uploadService.uploadFile(parameters))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("projectId");
            assertThat(storage.requestCount()).isZero();
        }
    }

    @Nested
    @DisplayName("upload handshake")
    class Handshake {

        @Test
        void initStoreAndConfirmInOrder() {
            api.respond(HttpStatus.OK, INIT).respond(HttpStatus.OK, CONFIRMED);
            storage.respondEmpty(HttpStatus.OK);

            MemicFile uploaded = uploadService.uploadFile(FileUploadParameters.builder()
                                                                              .filePath(file)
                                                                              .projectId("p1")
                                                                              .waitForReady(false)
                                                                              .build());

            assertThat(uploaded.id()).isEqualTo("f1");
            assertThat(uploaded.status()).isEqualTo(FileStatus.UPLOADED);

            RecordedRequest init = api.request(0);
            assertThat(init.method()).isEqualTo(HttpMethod.POST);
            assertThat(init.path()).isEqualTo("/projects/p1/files/init");
            assertThat(init.body()).isEqualTo("{\"filename\":\"notes.txt\",\"size\":11,\"mime_type\":\"text/plain\"}");

            RecordedRequest put = storage.request(0);
            assertThat(put.method()).isEqualTo(HttpMethod.PUT);
            assertThat(put.url().toString()).isEqualTo(UPLOAD_URL);
            assertThat(put.headers().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("text/plain");
            assertThat(put.headers().getContentLength()).isEqualTo(11);
            assertThat(put.headers().containsKey("X-API-Key")).isFalse();
            assertThat(put.body()).isEqualTo("hello world");

            RecordedRequest confirm = api.request(1);
            assertThat(confirm.method()).isEqualTo(HttpMethod.POST);
            assertThat(confirm.path()).isEqualTo("/projects/p1/files/f1/confirm");
            assertThat(api.requestCount()).isEqualTo(2);
        }

        @Test
        void referenceIdAndMetadataAreSentWhenGiven() {
            api.respond(HttpStatus.OK, INIT).respond(HttpStatus.OK, CONFIRMED);
            storage.respondEmpty(HttpStatus.OK);

            uploadService.uploadFile(FileUploadParameters.builder()
                                                         .filePath(file)
                                                         .projectId("p1")
                                                         .referenceId("lesson-1")
                                                         .metadataEntry("grade", 1)
                                                         .waitForReady(false)
                                                         .build());

            assertThat(api.request(0).body()).contains("\"reference_id\":\"lesson-1\"")
                                             .contains("\"metadata\":{\"grade\":1}");
        }

        @Test
        void storageRejectionStopsBeforeConfirm() {
            api.respond(HttpStatus.OK, INIT);
            storage.respondText(HttpStatus.FORBIDDEN, "SignatureDoesNotMatch");

            FileUploadParameters parameters = FileUploadParameters.builder().filePath(file).projectId("p1").build();

            assertThatThrownBy(() -> uploadService.uploadFile(parameters))
                    .isInstanceOfSatisfying(ApiException.class, e -> {
                        assertThat(e.getMessage()).isEqualTo("Failed to upload file to storage: SignatureDoesNotMatch");
                        assertThat(e.getStatusCode()).isEqualTo(403);
                    });
            assertThat(api.requestCount()).isEqualTo(1);
        }

        @Test
        void malformedUploadUrlIsAnApiError() {
            api.respond(HttpStatus.OK, "{\"file_id\":\"f1\",\"upload_url\":\"https://storage.test/bad path\"}");

            FileUploadParameters parameters = FileUploadParameters.builder().filePath(file).projectId("p1").build();

            assertThatThrownBy(() -> uploadService.uploadFile(parameters))
                    .isInstanceOfSatisfying(ApiException.class, e -> {
                        assertThat(e.getMessage()).startsWith("Invalid storage upload URL");
                        assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
                    });
            assertThat(storage.requestCount()).isZero();
            assertThat(api.requestCount()).isEqualTo(1);
        }

        @Test
        void projectFallsBackToTheKeyScope() {
            api.respond(HttpStatus.OK, "{\"organization_id\":\"org-1\",\"project_id\":\"scoped\"}")
               .respond(HttpStatus.OK, INIT)
               .respond(HttpStatus.OK, CONFIRMED);
            storage.respondEmpty(HttpStatus.OK);

            uploadService.uploadFile(FileUploadParameters.builder().filePath(file).waitForReady(false).build());

            assertThat(api.request(1).path()).isEqualTo("/projects/scoped/files/init");
        }

        @Test
        void waitsForReadyByDefault() {
            api.respond(HttpStatus.OK, INIT)
               .respond(HttpStatus.OK, CONFIRMED)
               .respond(HttpStatus.OK, "{\"id\":\"f1\",\"status\":\"chunking_started\"}")
               .respond(HttpStatus.OK, "{\"id\":\"f1\",\"status\":\"ready\",\"total_chunks\":4}");
            storage.respondEmpty(HttpStatus.OK);

            MemicFile ready = uploadService.uploadFile(FileUploadParameters.builder()
                                                                           .filePath(file)
                                                                           .projectId("p1")
                                                                           .build());

            assertThat(ready.isReady()).isTrue();
            assertThat(ready.totalChunks()).isEqualTo(4);
            assertThat(api.request(3).path()).isEqualTo("/projects/p1/files/f1/status");
            assertThat(sleeper.sleeps()).containsExactly(2000L);
        }
    }

    @Test
    void mimeTypeIsInferredFromTheExtension() {
        assertThat(FileUploadService.detectMimeType("report.pdf")).isEqualTo("application/pdf");
        assertThat(FileUploadService.detectMimeType("no-extension")).isEqualTo("application/octet-stream");
    }
}
