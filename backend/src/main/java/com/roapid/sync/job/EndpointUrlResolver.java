package com.roapid.sync.job;

import com.roapid.common.ConfigurationException;
import com.roapid.domain.JobIdentity;
import com.roapid.sync.config.OpenCloudProperties;
import com.roapid.sync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.IllegalFormatException;
import java.util.Map;

/**
 * Turns a job identity into the URL and headers of its remote API resource using {@code roapid.sync.api-map}.
 */
@Component
@RequiredArgsConstructor
public class EndpointUrlResolver {

    static final String PLACES = "places";
    static final String API_KEY_HEADER = "x-api-key";

    private final SyncProperties syncProperties;
    private final OpenCloudProperties openCloudProperties;

    /**
     * @throws ConfigurationException unknown endpoint type, malformed composite id, or missing API key
     */
    public ResolvedEndpoint resolve(JobIdentity identity) {
        String template = syncProperties.getApiMap().get(identity.endpointType());
        if (template == null || template.isBlank()) {
            throw new ConfigurationException("unknown endpoint type: " + identity.endpointType());
        }
        String url;
        try {
            url = String.format(template, pathArgument(identity));
        } catch (IllegalFormatException e) {
            throw new ConfigurationException("bad URL template for " + identity.endpointType() + ": " + template, e);
        }
        return new ResolvedEndpoint(url, headersFor(identity.endpointType()));
    }

    private static String pathArgument(JobIdentity identity) {
        if (!PLACES.equals(identity.endpointType())) {
            return identity.instanceId();
        }
        String[] parts = identity.instanceId().split("-", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ConfigurationException(
                    "invalid places id '" + identity.instanceId() + "', expected <universeId>-<placeId>");
        }
        return "universes/" + parts[0] + "/places/" + parts[1];
    }

    private Map<String, String> headersFor(String endpointType) {
        if (!syncProperties.getAuthenticatedEndpoints().contains(endpointType)) {
            return Map.of();
        }
        String apiKey = openCloudProperties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("roapid.open-cloud.api-key is required for " + endpointType);
        }
        return Map.of(API_KEY_HEADER, apiKey, "Accept", "application/json");
    }
}
