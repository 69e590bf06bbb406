package com.roapid.sync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dynamic endpoint config: how categories map to jobs, where each endpoint type fetches from, and how often.
 * Durations are strings ({@code 30s}, {@code 5m}, {@code PT1H}) so per-type values can fail individually.
 */
@ConfigurationProperties(prefix = "roapid.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Category labels look like {@code Category:<prefix>-<type>-<id>}. */
    private String categoryPrefix = "roapid";

    /** Period of the discovery sweep. Required, positive. */
    private String categoryCheckInterval;

    /** Period of the refresh sweep and default per-job interval. Required, positive. */
    private String dataRefreshInterval;

    /** Endpoint type → URL template with one {@code %s} placeholder. */
    private Map<String, String> apiMap = new HashMap<>();

    /** Optional endpoint type → interval overrides. */
    private Map<String, String> refreshIntervals = new HashMap<>();

    /** Endpoint types fetched with the Open Cloud API key. */
    private List<String> authenticatedEndpoints = new ArrayList<>(List.of("users", "groups", "universes", "places"));

    public void setApiMap(Map<String, String> apiMap) {
        this.apiMap = apiMap != null ? apiMap : new HashMap<>();
    }

    public void setRefreshIntervals(Map<String, String> refreshIntervals) {
        this.refreshIntervals = refreshIntervals != null ? refreshIntervals : new HashMap<>();
    }
}
