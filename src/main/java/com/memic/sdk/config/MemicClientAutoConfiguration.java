package com.memic.sdk.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.memic.sdk.MemicClient;
import com.memic.sdk.common.apiclient.authentication.Authentication;
import com.memic.sdk.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.common.apiclient.memic.config.MemicHeaderConfig;
import com.memic.sdk.common.apiclient.model.HeaderConfig;
import com.memic.sdk.common.apiclient.storage.PresignedUploadClient;
import com.memic.sdk.common.json.JsonParser;
import com.memic.sdk.common.json.jackson.JacksonJsonParser;
import com.memic.sdk.service.file.FileStatusService;
import com.memic.sdk.service.project.ProjectService;
import com.memic.sdk.service.search.SearchService;
import com.memic.sdk.service.upload.FileUploadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.http.MediaType;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

/**
 * Configures the beans of the Memic client: the {@link WebClient}s for the API and for storage
 * uploads, the API key {@link Authentication}, the services and the {@link MemicClient} facade.
 *
 * <p>Nothing is registered until an API key is configured, through {@code memic.api-key} or the
 * {@code MEMIC_API_KEY} environment variable. Bean methods are plain factories, so {@link MemicClient#create(MemicClientProperties)} reuses
 * them to wire a client without a Spring context.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(MemicClientProperties.class)
@ConditionalOnProperty(prefix = "memic", name = "api-key")
public class MemicClientAutoConfiguration {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Creates the {@link WebClient} bound to the Memic base URL. Redirects are followed, and JSON bodies
     * are written and read with the client's own snake_case {@link ObjectMapper}.
     */
    @Bean("memicWebClient")
    @ConditionalOnMissingBean(name = "memicWebClient")
    public WebClient memicWebClient(MemicClientProperties properties) {
        String baseUrl = properties.normalizedBaseUrl();
        log.info("Initializing Memic WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                        .baseUrl(baseUrl)
                        .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                        .exchangeStrategies(memicExchangeStrategies())
                        .build();
    }

    /**
     * Creates the {@link WebClient} used for presigned storage uploads. It has no base URL and no
     * default headers, so nothing meant for the Memic API reaches the storage provider.
     */
    @Bean("memicStorageWebClient")
    @ConditionalOnMissingBean(name = "memicStorageWebClient")
    public WebClient memicStorageWebClient() {
        return WebClient.builder().build();
    }

    @Bean("memicAuthentication")
    @ConditionalOnMissingBean(name = "memicAuthentication")
    public Authentication memicAuthentication(MemicClientProperties properties) {
        log.info("Initializing Memic authentication with header name: '{}'", properties.getApiKeyHeader());
        return new APIKeyAuthentication(properties.getApiKeyHeader(), properties.getApiKey());
    }

    @Bean("memicHeader")
    @ConditionalOnMissingBean(name = "memicHeader")
    public HeaderConfig memicHeader(MemicClientProperties properties) {
        return new MemicHeaderConfig(properties.getUserAgent());
    }

    @Bean("memicJsonParser")
    @ConditionalOnMissingBean(name = "memicJsonParser")
    public JsonParser memicJsonParser() {
        return new JacksonJsonParser(memicObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public MemicApiClient memicApiClient(@Qualifier("memicWebClient") WebClient webClient,
                                         @Qualifier("memicAuthentication") Authentication authentication,
                                         @Qualifier("memicHeader") HeaderConfig headerConfig,
                                         @Qualifier("memicJsonParser") JsonParser jsonParser,
                                         MemicClientProperties properties) {
        return new MemicApiClient(webClient, authentication, headerConfig, jsonParser, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public PresignedUploadClient presignedUploadClient(@Qualifier("memicStorageWebClient") WebClient webClient,
                                                       MemicClientProperties properties) {
        return new PresignedUploadClient(webClient, properties.uploadTimeout());
    }

    @Bean("memicPollSleeper")
    @ConditionalOnMissingBean(name = "memicPollSleeper")
    public Sleeper memicPollSleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean("memicClock")
    @ConditionalOnMissingBean(name = "memicClock")
    public Clock memicClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public FileStatusService fileStatusService(MemicApiClient apiClient, MemicClientProperties properties,
                                               @Qualifier("memicPollSleeper") Sleeper sleeper,
                                               @Qualifier("memicClock") Clock clock) {
        return new FileStatusService(apiClient, properties.getPolling(), sleeper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FileUploadService fileUploadService(MemicApiClient apiClient, PresignedUploadClient presignedUploadClient,
                                               FileStatusService fileStatusService) {
        return new FileUploadService(apiClient, presignedUploadClient, fileStatusService);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchService searchService(MemicApiClient apiClient) {
        return new SearchService(apiClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectService projectService(MemicApiClient apiClient) {
        return new ProjectService(apiClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public MemicClient memicClient(MemicApiClient apiClient, ProjectService projectService,
                                   FileUploadService fileUploadService, FileStatusService fileStatusService,
                                   SearchService searchService) {
        return new MemicClient(apiClient, projectService, fileUploadService, fileStatusService, searchService);
    }

    /**
     * Codecs of the Memic {@link WebClient}: the snake_case mapper for JSON and a 16 MB in-memory limit.
     */
    public static ExchangeStrategies memicExchangeStrategies() {
        ObjectMapper objectMapper = memicObjectMapper();
        return ExchangeStrategies.builder()
                                 .codecs(configurer -> {
                                     configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                                     configurer.defaultCodecs().jackson2JsonEncoder(
                                             new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON));
                                     configurer.defaultCodecs().jackson2JsonDecoder(
                                             new Jackson2JsonDecoder(objectMapper, MediaType.APPLICATION_JSON));
                                 })
                                 .build();
    }

    /**
     * The mapper used for Memic payloads. It is not exposed as a bean so that the application's own
     * {@link ObjectMapper} keeps its settings.
     */
    public static ObjectMapper memicObjectMapper() {
        return new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                                 .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                                 .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                                 .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                                 .registerModule(new JavaTimeModule());
    }
}
