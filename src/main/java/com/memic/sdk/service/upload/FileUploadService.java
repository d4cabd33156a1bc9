package com.memic.sdk.service.upload;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.common.apiclient.storage.PresignedUploadClient;
import com.memic.sdk.dto.mapper.MemicResponseMapper;
import com.memic.sdk.dto.upload.FileUploadParameters;
import com.memic.sdk.dto.upload.request.InitUploadRequest;
import com.memic.sdk.dto.upload.response.InitUploadResponse;
import com.memic.sdk.exception.LocalFileNotFoundException;
import com.memic.sdk.exception.MemicException;
import com.memic.sdk.model.MemicFile;
import com.memic.sdk.service.file.FileStatusService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Uploads local files through the presigned-URL handshake: init, storage PUT, confirm, and
 * optionally waits for processing to finish.
 */
@Slf4j
public class FileUploadService {

    private final MemicApiClient apiClient;
    private final PresignedUploadClient presignedUploadClient;
    private final FileStatusService fileStatusService;

    public FileUploadService(MemicApiClient apiClient, PresignedUploadClient presignedUploadClient,
                             FileStatusService fileStatusService) {
        this.apiClient = apiClient;
        this.presignedUploadClient = presignedUploadClient;
        this.fileStatusService = fileStatusService;
    }

    /**
     * Uploads a file to a project.
     *
     * @param parameters the file and upload options
     *
     * @return the file as confirmed, or once ready when {@code waitForReady} is set
     *
     * @throws LocalFileNotFoundException if the file does not exist; no request is sent in that case
     * @throws IllegalArgumentException   if no project is given and the API key is not project-scoped
     */
    public MemicFile uploadFile(FileUploadParameters parameters) {
        Path filePath = parameters.getFilePath();
        if (!Files.isRegularFile(filePath)) {
            throw new LocalFileNotFoundException(filePath);
        }

        String filename = FilenameUtils.getName(filePath.toString());
        long size = sizeOf(filePath);
        String mimeType = detectMimeType(filename);
        String projectId = resolveProjectId(parameters.getProjectId());

        InitUploadRequest initRequest = new InitUploadRequest(
                filename,
                size,
                mimeType,
                StringUtils.hasText(parameters.getReferenceId()) ? parameters.getReferenceId() : null,
                CollectionUtils.isEmpty(parameters.getMetadata()) ? null : parameters.getMetadata());
        InitUploadResponse initResponse = apiClient.initUpload(projectId, initRequest);
        log.debug("Upload of '{}' assigned file id {}", filename, initResponse.fileId());

        presignedUploadClient.upload(initResponse.uploadUrl(), filePath, size, mimeType);

        MemicFile file = MemicResponseMapper.toFile(apiClient.confirmUpload(projectId, initResponse.fileId()));
        log.info("File {} confirmed in project {} with status {}", file.id(), projectId, file.status().getValue());

        if (!parameters.isWaitForReady()) {
            return file;
        }
        if (parameters.getPollInterval() == null && parameters.getPollTimeout() == null) {
            return fileStatusService.waitForReady(projectId, file.id());
        }
        return fileStatusService.waitForReady(projectId, file.id(),
                                              Optional.ofNullable(parameters.getPollInterval())
                                                      .orElseGet(fileStatusService::defaultPollInterval),
                                              Optional.ofNullable(parameters.getPollTimeout())
                                                      .orElseGet(fileStatusService::defaultPollTimeout));
    }

    /**
     * Infers the MIME type from the file name, falling back to {@code application/octet-stream}.
     */
    static String detectMimeType(String filename) {
        return MediaTypeFactory.getMediaType(filename)
                               .map(MediaType::toString)
                               .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    private String resolveProjectId(String projectId) {
        if (StringUtils.hasText(projectId)) {
            return projectId;
        }
        String scopedProjectId = apiClient.apiKeyContext().projectId();
        if (!StringUtils.hasText(scopedProjectId)) {
            throw new IllegalArgumentException("projectId is required: the API key is not scoped to a project");
        }
        log.debug("Using project {} of the API key", scopedProjectId);
        return scopedProjectId;
    }

    private static long sizeOf(Path filePath) {
        try {
            return Files.size(filePath);
        } catch (IOException e) {
            throw new MemicException("Failed to read size of " + filePath, e);
        }
    }
}
