package com.roapid.sync.job;

import java.util.Map;

/**
 * Concrete fetch target for one job.
 */
public record ResolvedEndpoint(String url, Map<String, String> headers) {

    public ResolvedEndpoint {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }
}
