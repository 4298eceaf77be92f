package com.bundleradar.ingestion.adapter;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * {@link ProviderHttpClient} backed by WebClient. Non-2xx responses surface as {@link ProviderException}.
 */
public class WebClientProviderHttpClient implements ProviderHttpClient {

    private final WebClient webClient;

    public WebClientProviderHttpClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> get(String url, Map<String, String> headers) {
        return webClient.get()
                .uri(URI.create(url))
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ProviderException(e.getStatusCode().value() + " from " + url + ": " + e.getMessage(), e));
    }
}
