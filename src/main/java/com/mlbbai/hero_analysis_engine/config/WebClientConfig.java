/**
 * Configuration for the provider WebClient
 * - Defines the WebClient used for statistics provider calls
 * - Sets timeouts and connection settings from app.provider.*
 *
 * @author William Callahan
 */
package com.mlbbai.hero_analysis_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates the WebClient for the statistics provider
     * - Base URL, user agent and JSON accept header preset
     * - Connect, read, write and response timeouts all bounded by app.provider.timeout
     *
     * @param properties application properties
     * @return WebClient bound to the provider base URL
     */
    @Bean
    public WebClient providerWebClient(HeroEngineProperties properties) {
        HeroEngineProperties.Provider provider = properties.getProvider();
        Duration timeout = provider.getTimeout();
        long timeoutMillis = timeout.toMillis();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .baseUrl(provider.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, provider.getUserAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
