package com.roapid.adapter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote API client settings.
 */
@ConfigurationProperties(prefix = "roapid.fetch")
@NoArgsConstructor
@Getter
@Setter
public class FetchProperties {

    /** Global fetch budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 10;

    /** How long a fetch may wait for a permit before failing. */
    private long limiterTimeoutMs = 5_000;

    /** Largest accepted response body. */
    private int maxPayloadBytes = 16 * 1024 * 1024;

    private String userAgent = "roapid-sync/0.1";
}
