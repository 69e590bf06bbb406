package com.roapid.adapter.fetch;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.Map;

/**
 * Remote API client using WebClient. Every call takes a permit from the shared fetch rate limiter first.
 */
@Slf4j
public class WebClientApiFetcher implements ApiFetcher {

    private final WebClient webClient;
    private final RateLimiter fetchRateLimiter;

    public WebClientApiFetcher(WebClient.Builder builder, RateLimiter fetchRateLimiter, String userAgent, int maxPayloadBytes) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxPayloadBytes))
                .build();
        this.fetchRateLimiter = fetchRateLimiter;
    }

    @Override
    public byte[] fetch(String url, Map<String, String> headers) {
        if (!fetchRateLimiter.acquirePermission()) {
            throw new FetchException("Fetch budget exhausted, not calling " + url);
        }
        log.debug("GET {}", url);
        try {
            byte[] body = webClient.get()
                    .uri(URI.create(url))
                    .headers(h -> {
                        if (headers != null) {
                            headers.forEach(h::set);
                        }
                    })
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .onErrorMap(WebClientResponseException.class,
                            e -> new FetchException("GET " + url + " returned " + e.getStatusCode().value(), e))
                    .onErrorMap(WebClientRequestException.class,
                            e -> new FetchException("GET " + url + " failed: " + e.getMessage(), e))
                    .block();
            return body != null ? body : new byte[0];
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FetchException("GET " + url + " failed: " + e.getMessage(), e);
        }
    }
}
