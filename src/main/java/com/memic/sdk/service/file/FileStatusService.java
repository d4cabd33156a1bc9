package com.memic.sdk.service.file;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.config.MemicClientProperties;
import com.memic.sdk.dto.mapper.MemicResponseMapper;
import com.memic.sdk.exception.FileProcessingException;
import com.memic.sdk.exception.MemicException;
import com.memic.sdk.exception.ProcessingTimeoutException;
import com.memic.sdk.model.MemicFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads and tracks the processing status of uploaded files.
 */
@Slf4j
public class FileStatusService {

    private final MemicApiClient apiClient;
    private final MemicClientProperties.Polling polling;
    private final Sleeper sleeper;
    private final Clock clock;

    public FileStatusService(MemicApiClient apiClient, MemicClientProperties.Polling polling, Sleeper sleeper,
                             Clock clock) {
        this.apiClient = apiClient;
        this.polling = polling;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public Duration defaultPollInterval() {
        return polling.getInterval();
    }

    public Duration defaultPollTimeout() {
        return polling.getTimeout();
    }

    public MemicFile getFileStatus(String projectId, String fileId) {
        return MemicResponseMapper.toFile(apiClient.getFileStatus(projectId, fileId));
    }

    public void deleteFile(String projectId, String fileId) {
        apiClient.deleteFile(projectId, fileId);
    }

    /**
     * Waits for a file to become ready using the configured poll interval and timeout.
     *
     * @see #waitForReady(String, String, Duration, Duration)
     */
    public MemicFile waitForReady(String projectId, String fileId) {
        return waitForReady(projectId, fileId, polling.getInterval(), polling.getTimeout());
    }

    /**
     * Polls the status of a file at a fixed interval until it is ready.
     *
     * <p>The deadline is checked after each status read, so at least one read always happens. There
     * is no backoff and no cancellation other than the timeout.
     *
     * @param projectId    project containing the file
     * @param fileId       file to wait for
     * @param pollInterval time between two status reads
     * @param pollTimeout  maximum total time to wait
     *
     * @return the file in status {@code ready}
     *
     * @throws FileProcessingException     if the pipeline reports a {@code *_failed} status
     * @throws ProcessingTimeoutException  if the file is still processing when the timeout elapses
     * @throws MemicException              if the waiting thread is interrupted
     */
    public MemicFile waitForReady(String projectId, String fileId, Duration pollInterval, Duration pollTimeout) {
        log.info("Waiting up to {} s for file {} to be ready", pollTimeout.toSeconds(), fileId);
        Instant start = clock.instant();

        while (true) {
            MemicFile file = getFileStatus(projectId, fileId);
            log.debug("File {} is in status {}", fileId, file.status().getValue());

            if (file.isReady()) {
                log.info("File {} is ready with {} chunks", fileId, file.totalChunks());
                return file;
            }

            if (file.status().isFailed()) {
                log.warn("File {} failed with status {}: {}", fileId, file.status().getValue(), file.errorMessage());
                throw new FileProcessingException(fileId, file.status(), file.errorMessage());
            }

            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(pollTimeout) >= 0) {
                log.warn("Gave up waiting for file {} after {} s in status {}", fileId, elapsed.toSeconds(),
                         file.status().getValue());
                throw new ProcessingTimeoutException(fileId, file.status(), pollTimeout);
            }

            sleep(pollInterval, fileId);
        }
    }

    private void sleep(Duration pollInterval, String fileId) {
        try {
            sleeper.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemicException("Interrupted while waiting for file " + fileId + " to be ready", e);
        }
    }
}
