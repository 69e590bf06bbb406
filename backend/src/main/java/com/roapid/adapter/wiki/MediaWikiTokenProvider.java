package com.roapid.adapter.wiki;

import com.fasterxml.jackson.databind.JsonNode;
import com.roapid.common.SyncErrorKind;
import com.roapid.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;

/**
 * CSRF token for edits, cached per session. Evicted when the wiki answers {@code badtoken}.
 */
@Slf4j
@RequiredArgsConstructor
public class MediaWikiTokenProvider {

    private final MediaWikiApi api;

    @Cacheable(cacheNames = CaffeineConfig.WIKI_TOKEN_CACHE, key = "'csrf'")
    public String csrfToken() {
        JsonNode root = api.get(MediaWikiApi.params("action", "query", "meta", "tokens", "type", "csrf"),
                SyncErrorKind.PUBLISH);
        String token = root.path("query").path("tokens").path("csrftoken").asText("");
        if (token.isEmpty() || "+\\".equals(token)) {
            throw new WikiException(SyncErrorKind.PUBLISH, "No csrf token returned; session not logged in");
        }
        return token;
    }

    @CacheEvict(cacheNames = CaffeineConfig.WIKI_TOKEN_CACHE, allEntries = true)
    public void evict() {
        log.debug("Evicted cached wiki tokens");
    }
}
