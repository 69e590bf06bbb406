package com.roapid.adapter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roapid.adapter.fetch.ApiFetcher;
import com.roapid.adapter.fetch.WebClientApiFetcher;
import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.storage.FileArtifactStore;
import com.roapid.adapter.wiki.MediaWikiApi;
import com.roapid.adapter.wiki.MediaWikiClient;
import com.roapid.adapter.wiki.MediaWikiTokenProvider;
import com.roapid.adapter.wiki.WikiClient;
import com.roapid.common.ConfigurationException;
import com.roapid.common.IntervalThrottle;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the external collaborators: artifact files, remote API fetcher, MediaWiki client.
 */
@Configuration
@EnableConfigurationProperties({ StorageProperties.class, FetchProperties.class, WikiProperties.class })
public class AdapterConfig {

    public static final String FETCH_RATE_LIMITER = "fetchRateLimiter";
    public static final String WIKI_EDIT_THROTTLE = "wikiEditThrottle";

    @Bean
    public ArtifactStore artifactStore(StorageProperties properties, Clock clock) {
        return new FileArtifactStore(Path.of(properties.getDataDir()), clock);
    }

    @Bean(name = FETCH_RATE_LIMITER)
    public RateLimiter fetchRateLimiter(FetchProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("api-fetch", config);
    }

    @Bean
    public ApiFetcher apiFetcher(WebClient.Builder webClientBuilder,
                                 FetchProperties properties,
                                 @Qualifier(FETCH_RATE_LIMITER) RateLimiter fetchRateLimiter) {
        return new WebClientApiFetcher(webClientBuilder, fetchRateLimiter,
                properties.getUserAgent(), properties.getMaxPayloadBytes());
    }

    @Bean(name = WIKI_EDIT_THROTTLE)
    public IntervalThrottle wikiEditThrottle(WikiProperties properties) {
        return new IntervalThrottle(properties.getEditInterval());
    }

    @Bean
    public MediaWikiApi mediaWikiApi(WebClient.Builder webClientBuilder, WikiProperties properties, ObjectMapper objectMapper) {
        if (properties.getApiUrl() == null || properties.getApiUrl().isBlank()) {
            throw new ConfigurationException("roapid.wiki.api-url is required");
        }
        return new MediaWikiApi(webClientBuilder, properties.getApiUrl(), properties.getUserAgent(), objectMapper);
    }

    @Bean
    public MediaWikiTokenProvider mediaWikiTokenProvider(MediaWikiApi mediaWikiApi) {
        return new MediaWikiTokenProvider(mediaWikiApi);
    }

    @Bean
    public WikiClient wikiClient(MediaWikiApi mediaWikiApi,
                                 MediaWikiTokenProvider tokenProvider,
                                 @Qualifier(WIKI_EDIT_THROTTLE) IntervalThrottle editThrottle,
                                 WikiProperties properties) {
        return new MediaWikiClient(mediaWikiApi, tokenProvider, editThrottle,
                properties.getUsername(), properties.getPassword(), properties.isRequireBotRight());
    }
}
