package com.roapid.adapter.fetch;

import java.util.Map;

/**
 * Plain HTTP GET of a remote API resource.
 */
public interface ApiFetcher {

    /**
     * @param headers extra request headers, empty for anonymous endpoints
     * @return response body
     * @throws FetchException on any failure
     */
    byte[] fetch(String url, Map<String, String> headers);
}
