package com.roapid.sync.docs;

import com.roapid.adapter.config.WikiProperties;
import com.roapid.adapter.wiki.WikiClient;
import com.roapid.common.ConfigurationException;
import com.roapid.sync.config.SyncProperties;
import com.roapid.sync.config.WikiModuleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the Lua module page that reads the published JSON at the configured version.
 * The version lives in the page's first line as {@code -- <version>}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WikiModuleInstaller {

    static final String VERSION_MARKER = "-- ";

    private final WikiModuleProperties properties;
    private final WikiProperties wikiProperties;
    private final SyncProperties syncProperties;
    private final WikiClient wikiClient;

    public String pageTitle() {
        return wikiProperties.getNamespace() + ":Roapid";
    }

    /**
     * @return true when the page was written
     */
    public boolean install() {
        if (!properties.isEnabled()) {
            log.debug("Wiki module installer disabled");
            return false;
        }
        String required = properties.getVersion();
        String content = render(readTemplate());
        String title = pageTitle();

        Optional<String> existing = wikiClient.pageContent(title);
        if (existing.isEmpty()) {
            log.info("Page {} not found. Creating with version {}", title, required);
            wikiClient.push(title, content, "Initializing Roapid module, version " + required);
            return true;
        }

        String firstLine = existing.get().lines().findFirst().orElse("");
        if (!firstLine.startsWith(VERSION_MARKER)) {
            log.info("Page {} missing version comment. Overwriting with version {}", title, required);
            wikiClient.push(title, content, "Updating Roapid module to version " + required);
            return true;
        }

        String current = firstLine.substring(VERSION_MARKER.length()).strip();
        if (!current.equals(required)) {
            log.info("Updating {}: version {} to {}", title, current, required);
            wikiClient.push(title, content, "Updating Roapid module from " + current + " to " + required);
            return true;
        }
        log.info("Page {} is up to date (version {})", title, required);
        return false;
    }

    String render(String template) {
        String content = template
                .replace("{{NAMESPACE}}", wikiProperties.getNamespace())
                .replace("{{CATEGORY_PREFIX}}", syncProperties.getCategoryPrefix())
                .replace("{{MSG_QUEUE_NOTE}}", properties.getQueueNote())
                .replace("{{MSG_FIELD_PATH_NOT_FOUND}}", properties.getFieldPathNotFound());
        String header = VERSION_MARKER + properties.getVersion();
        String firstLine = content.lines().findFirst().orElse("");
        if (firstLine.strip().equals(header)) {
            return content;
        }
        return header + "\n" + content;
    }

    private String readTemplate() {
        Path source = Path.of(properties.getSource());
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read wiki module template " + source, e);
        }
    }
}
