/**
 * Client for the hero statistics provider
 *
 * @author William Callahan
 *
 * Features:
 * - Issues GET requests against the provider base URL and returns raw JSON trees
 * - Bounds every call with the configured provider timeout
 * - Maps transport failures onto {@link HeroDataException} reasons
 * - Logs each request and response through ExternalApiLogger
 */
package com.mlbbai.hero_analysis_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class MlbbStatsApiFetcher {

    private static final String API_NAME = "MLBB-STATS";

    private final WebClient webClient;
    private final Duration timeout;

    /**
     * @param providerWebClient WebClient bound to the provider base URL
     * @param properties application properties
     */
    public MlbbStatsApiFetcher(WebClient providerWebClient, HeroEngineProperties properties) {
        this.webClient = providerWebClient;
        this.timeout = properties.getProvider().getTimeout();
    }

    /**
     * Fetches one provider path, e.g. {@code /hero-rank/}.
     *
     * @param path path relative to the provider base URL
     * @return the JSON body; errors with {@link HeroDataException} on timeout, HTTP error or an empty body
     */
    public Mono<JsonNode> get(String path) {
        ExternalApiLogger.logHttpRequest(log, API_NAME, "GET", path);
        return webClient.get()
            .uri(path)
            .retrieve()
            .toEntity(JsonNode.class)
            .timeout(timeout)
            .doOnNext(entity -> {
                JsonNode body = entity.getBody();
                int responseSize = body == null ? 0 : body.toString().length();
                ExternalApiLogger.logHttpResponse(log, API_NAME, entity.getStatusCode().value(), path, responseSize);
            })
            .flatMap(entity -> entity.getBody() == null
                ? Mono.error(new HeroDataException(HeroDataException.Reason.SHAPE_MISMATCH, "Empty body from " + path))
                : Mono.just(entity.getBody()))
            .switchIfEmpty(Mono.error(() -> new HeroDataException(HeroDataException.Reason.SHAPE_MISMATCH, "No response from " + path)))
            .onErrorMap(e -> !(e instanceof HeroDataException), e -> translate(path, e))
            .doOnError(e -> ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", path, e.getMessage()));
    }

    private HeroDataException translate(String path, Throwable e) {
        if (e instanceof TimeoutException) {
            return new HeroDataException(HeroDataException.Reason.FETCH_TIMEOUT,
                "Timed out after " + timeout.toMillis() + "ms fetching " + path, e);
        }
        if (e instanceof WebClientResponseException wcre) {
            return new HeroDataException(HeroDataException.Reason.FETCH_NETWORK_ERROR,
                "HTTP " + wcre.getStatusCode().value() + " fetching " + path, e);
        }
        return new HeroDataException(HeroDataException.Reason.FETCH_NETWORK_ERROR,
            "Error fetching " + path + ": " + e.getMessage(), e);
    }
}
