package com.roapid.adapter.wiki;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roapid.common.SyncErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Low-level MediaWiki action API transport: JSON format v2, session cookies kept, {@code error} objects raised.
 */
@Slf4j
public class MediaWikiApi {

    private final WebClient webClient;
    private final String apiUrl;
    private final ObjectMapper objectMapper;

    public MediaWikiApi(WebClient.Builder builder, String apiUrl, String userAgent, ObjectMapper objectMapper) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .filter(new SessionCookieFilter())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        this.apiUrl = apiUrl;
        this.objectMapper = objectMapper;
    }

    public static MultiValueMap<String, String> params(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("params needs key/value pairs");
        }
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.set(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    /**
     * GET for read-only modules (query).
     */
    public JsonNode get(MultiValueMap<String, String> params, SyncErrorKind kind) {
        MultiValueMap<String, String> all = withFormat(params);
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(apiUrl);
        all.forEach((k, values) -> values.forEach(v ->
                uri.queryParam(k, UriUtils.encodeQueryParam(v, StandardCharsets.UTF_8).replace("+", "%2B"))));
        URI target = uri.build(true).toUri();
        log.debug("wiki GET action={}", all.getFirst("action"));
        try {
            String body = webClient.get()
                    .uri(target)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return parse(body, kind);
        } catch (WebClientResponseException e) {
            throw new WikiException(kind, "Wiki API returned " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            throw new WikiException(kind, "Wiki API call failed: " + e.getMessage(), e);
        }
    }

    /**
     * POST (form-encoded) for modules that change state: login, edit, purge.
     */
    public JsonNode post(MultiValueMap<String, String> params, SyncErrorKind kind) {
        MultiValueMap<String, String> all = withFormat(params);
        log.debug("wiki POST action={}", all.getFirst("action"));
        try {
            String body = webClient.post()
                    .uri(URI.create(apiUrl))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(all))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return parse(body, kind);
        } catch (WebClientResponseException e) {
            throw new WikiException(kind, "Wiki API returned " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            throw new WikiException(kind, "Wiki API call failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body, SyncErrorKind kind) {
        if (body == null || body.isBlank()) {
            throw new WikiException(kind, "Empty wiki API response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new WikiException(kind, "Unreadable wiki API response", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String code = error.path("code").asText("unknown");
            String info = error.path("info").asText("");
            throw new WikiException(kind, code, "Wiki API error " + code + ": " + info, null);
        }
        return root;
    }

    private static MultiValueMap<String, String> withFormat(MultiValueMap<String, String> params) {
        MultiValueMap<String, String> all = new LinkedMultiValueMap<>(params);
        all.set("format", "json");
        all.set("formatversion", "2");
        return all;
    }
}
