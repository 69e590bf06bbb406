package com.roapid.adapter.wiki;

import org.springframework.http.ResponseCookie;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the MediaWiki session cookies between calls (login session, centralauth tokens).
 */
class SessionCookieFilter implements ExchangeFilterFunction {

    private final Map<String, String> cookies = new ConcurrentHashMap<>();

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        ClientRequest withCookies = ClientRequest.from(request)
                .cookies(c -> cookies.forEach(c::set))
                .build();
        return next.exchange(withCookies).doOnNext(this::remember);
    }

    private void remember(ClientResponse response) {
        for (List<ResponseCookie> values : response.cookies().values()) {
            for (ResponseCookie cookie : values) {
                if (cookie.getMaxAge().isZero() || cookie.getValue().isEmpty()) {
                    cookies.remove(cookie.getName());
                } else {
                    cookies.put(cookie.getName(), cookie.getValue());
                }
            }
        }
    }

    Map<String, String> snapshot() {
        return Map.copyOf(cookies);
    }
}
