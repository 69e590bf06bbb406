package com.roapid.adapter.wiki;

import com.fasterxml.jackson.databind.JsonNode;
import com.roapid.common.ConfigurationException;
import com.roapid.common.IntervalThrottle;
import com.roapid.common.SyncErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link WikiClient} over the MediaWiki action API. Edits go through the shared edit throttle.
 */
@Slf4j
public class MediaWikiClient implements WikiClient {

    static final int PURGE_BATCH_SIZE = 50;
    private static final String BOT_RIGHT = "bot";

    private final MediaWikiApi api;
    private final MediaWikiTokenProvider tokenProvider;
    private final IntervalThrottle editThrottle;
    private final String username;
    private final String password;
    private final boolean requireBotRight;

    public MediaWikiClient(MediaWikiApi api,
                           MediaWikiTokenProvider tokenProvider,
                           IntervalThrottle editThrottle,
                           String username,
                           String password,
                           boolean requireBotRight) {
        this.api = api;
        this.tokenProvider = tokenProvider;
        this.editThrottle = editThrottle;
        this.username = username;
        this.password = password;
        this.requireBotRight = requireBotRight;
    }

    @Override
    public void login() {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new ConfigurationException("Wiki username and password are required");
        }
        JsonNode tokens = api.get(MediaWikiApi.params("action", "query", "meta", "tokens", "type", "login"),
                SyncErrorKind.CONFIG);
        String loginToken = tokens.path("query").path("tokens").path("logintoken").asText("");
        if (loginToken.isEmpty()) {
            throw new ConfigurationException("Wiki did not return a login token");
        }

        JsonNode login = api.post(MediaWikiApi.params(
                "action", "login",
                "lgname", username,
                "lgpassword", password,
                "lgtoken", loginToken), SyncErrorKind.CONFIG);
        String result = login.path("login").path("result").asText("");
        if (!"Success".equals(result)) {
            String reason = login.path("login").path("reason").asText(result);
            throw new ConfigurationException("Wiki login failed for " + username + ": " + reason);
        }
        tokenProvider.evict();

        JsonNode userinfo = api.get(MediaWikiApi.params("action", "query", "meta", "userinfo", "uiprop", "rights"),
                SyncErrorKind.CONFIG);
        boolean hasBot = false;
        for (JsonNode right : userinfo.path("query").path("userinfo").path("rights")) {
            if (BOT_RIGHT.equals(right.asText())) {
                hasBot = true;
                break;
            }
        }
        if (!hasBot && requireBotRight) {
            throw new ConfigurationException("User " + username + " does not have the bot right; refusing to edit");
        }
        log.info("Logged in to wiki as {} (bot right: {})", username, hasBot);
    }

    @Override
    public void push(String title, String content, String summary) {
        editThrottle.acquire();
        log.debug("Pushing page {} (summary: {})", title, summary);
        String token = tokenProvider.csrfToken();
        JsonNode response;
        try {
            response = api.post(MediaWikiApi.params(
                    "action", "edit",
                    "title", title,
                    "text", content,
                    "summary", summary,
                    "bot", "true",
                    "token", token), SyncErrorKind.PUBLISH);
        } catch (WikiException e) {
            if ("badtoken".equals(e.getApiCode())) {
                tokenProvider.evict();
            }
            log.warn("Push of {} failed: {}", title, e.getMessage());
            throw e;
        }
        String result = response.path("edit").path("result").asText("");
        if (!"Success".equals(result)) {
            throw new WikiException(SyncErrorKind.PUBLISH, "Edit of " + title + " not accepted: " + response.path("edit"));
        }
        log.info("Pushed {}", title);
    }

    @Override
    public boolean pageExists(String title) {
        JsonNode page = firstPage(api.get(MediaWikiApi.params(
                "action", "query",
                "prop", "info",
                "titles", title), SyncErrorKind.PUBLISH));
        return page != null && isPresent(page);
    }

    @Override
    public Optional<String> pageContent(String title) {
        JsonNode page = firstPage(api.get(MediaWikiApi.params(
                "action", "query",
                "prop", "revisions",
                "titles", title,
                "rvprop", "content",
                "rvslots", "main"), SyncErrorKind.PUBLISH));
        if (page == null || !isPresent(page)) {
            return Optional.empty();
        }
        JsonNode content = page.path("revisions").path(0).path("slots").path("main").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new WikiException(SyncErrorKind.PUBLISH, "No revisions found for " + title);
        }
        return Optional.of(content.asText());
    }

    @Override
    public List<String> categoriesWithPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix cannot be empty");
        }
        String acPrefix = Character.toUpperCase(prefix.charAt(0)) + prefix.substring(1);
        List<String> titles = new ArrayList<>();
        for (JsonNode cat : listAll("allcategories", MediaWikiApi.params(
                "action", "query",
                "list", "allcategories",
                "acprefix", acPrefix,
                "aclimit", "max"), SyncErrorKind.DISCOVERY)) {
            String name = cat.path("category").asText("");
            if (name.isEmpty()) {
                name = cat.path("*").asText("");
            }
            if (!name.isEmpty()) {
                titles.add("Category:" + name);
            }
        }
        return titles;
    }

    @Override
    public List<String> categoryMembers(String category) {
        if (category == null || category.isEmpty()) {
            throw new IllegalArgumentException("category cannot be empty");
        }
        String cmTitle = category.regionMatches(true, 0, "Category:", 0, 9) ? category : "Category:" + category;
        List<String> titles = new ArrayList<>();
        for (JsonNode member : listAll("categorymembers", MediaWikiApi.params(
                "action", "query",
                "list", "categorymembers",
                "cmtitle", cmTitle,
                "cmlimit", "max"), SyncErrorKind.PURGE)) {
            String title = member.path("title").asText("");
            if (!title.isEmpty()) {
                titles.add(title);
            }
        }
        return titles;
    }

    @Override
    public void purgePages(List<String> titles) {
        if (titles == null || titles.isEmpty()) {
            return;
        }
        for (int from = 0; from < titles.size(); from += PURGE_BATCH_SIZE) {
            List<String> batch = titles.subList(from, Math.min(titles.size(), from + PURGE_BATCH_SIZE));
            api.post(MediaWikiApi.params("action", "purge", "titles", String.join("|", batch)), SyncErrorKind.PURGE);
        }
        log.debug("Purged {} page(s)", titles.size());
    }

    @Override
    public void purgeCategoryMembers(String category) {
        try {
            purgePages(categoryMembers(category));
        } catch (WikiException e) {
            throw e.withKind(SyncErrorKind.PURGE);
        }
    }

    /**
     * Runs a list query following {@code continue} until exhausted.
     */
    private List<JsonNode> listAll(String listName, MultiValueMap<String, String> params, SyncErrorKind kind) {
        List<JsonNode> out = new ArrayList<>();
        MultiValueMap<String, String> request = params;
        while (true) {
            JsonNode root = api.get(request, kind);
            root.path("query").path(listName).forEach(out::add);
            JsonNode cont = root.get("continue");
            if (cont == null || !cont.isObject()) {
                return out;
            }
            request = new LinkedMultiValueMap<>(params);
            Iterator<Map.Entry<String, JsonNode>> fields = cont.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                request.set(f.getKey(), f.getValue().asText());
            }
        }
    }

    private static JsonNode firstPage(JsonNode root) {
        JsonNode pages = root.path("query").path("pages");
        if (!pages.isArray() || pages.isEmpty()) {
            return null;
        }
        return pages.get(0);
    }

    private static boolean isPresent(JsonNode page) {
        if (page.path("missing").asBoolean(false) || page.path("invalid").asBoolean(false)) {
            return false;
        }
        return page.path("pageid").asLong(0) > 0;
    }
}
