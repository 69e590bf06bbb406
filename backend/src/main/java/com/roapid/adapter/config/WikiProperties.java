package com.roapid.adapter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * MediaWiki connection. Credentials are expected from the environment (bot password).
 */
@ConfigurationProperties(prefix = "roapid.wiki")
@NoArgsConstructor
@Getter
@Setter
public class WikiProperties {

    private String apiUrl;
    private String username;
    private String password;

    /** Namespace of published pages, e.g. {@code Module} → {@code Module:roapid/badges-1.json}. */
    private String namespace = "Module";

    private String userAgent = "roapid-sync/0.1";

    /** Minimum spacing between two edits. */
    private Duration editInterval = Duration.ofSeconds(1);

    /** Refuse to start when the account lacks the bot right. */
    private boolean requireBotRight = true;
}
