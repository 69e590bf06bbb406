package com.roapid.sync.config;

import com.roapid.common.ConfigurationException;
import com.roapid.sync.schedule.IntervalResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.Map;

/**
 * Validated sweep periods plus per-endpoint interval lookup.
 * Global values are checked once at construction; per-endpoint values fall back to the global default.
 */
@Slf4j
public class SyncIntervals implements IntervalResolver {

    private final Duration categoryCheckInterval;
    private final Duration dataRefreshInterval;
    private final Map<String, String> refreshIntervals;

    public SyncIntervals(SyncProperties properties) {
        this.categoryCheckInterval = parseRequired("roapid.sync.category-check-interval", properties.getCategoryCheckInterval());
        this.dataRefreshInterval = parseRequired("roapid.sync.data-refresh-interval", properties.getDataRefreshInterval());
        this.refreshIntervals = Map.copyOf(properties.getRefreshIntervals());
    }

    public Duration categoryCheckInterval() {
        return categoryCheckInterval;
    }

    public Duration dataRefreshInterval() {
        return dataRefreshInterval;
    }

    /**
     * Per-type interval if configured and valid, otherwise the global refresh interval.
     */
    @Override
    public Duration intervalFor(String endpointType) {
        String raw = endpointType != null ? refreshIntervals.get(endpointType) : null;
        if (raw == null || raw.isBlank()) {
            return dataRefreshInterval;
        }
        try {
            return parsePositive(raw);
        } catch (ConfigurationException e) {
            log.warn("Invalid refresh interval for {}: {}; using {}", endpointType, e.getMessage(), dataRefreshInterval);
            return dataRefreshInterval;
        }
    }

    /**
     * Optional interval with a fallback, for secondary timers (static documents).
     */
    public Duration intervalOrDefault(String raw) {
        if (raw == null || raw.isBlank()) {
            return dataRefreshInterval;
        }
        return parseRequired("interval", raw);
    }

    static Duration parseRequired(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException(name + " is required");
        }
        try {
            return parsePositive(raw);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(name + ": " + e.getMessage(), e);
        }
    }

    static Duration parsePositive(String raw) {
        Duration d;
        try {
            d = DurationStyle.detectAndParse(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("'" + raw + "' is not a duration", e);
        }
        if (d.isZero() || d.isNegative()) {
            throw new ConfigurationException("'" + raw + "' must be positive");
        }
        return d;
    }
}
