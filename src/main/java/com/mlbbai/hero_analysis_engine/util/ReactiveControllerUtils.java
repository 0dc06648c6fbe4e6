package com.mlbbai.hero_analysis_engine.util;

import com.mlbbai.hero_analysis_engine.controller.support.ErrorResponseUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Shared response wrapping for reactive controller methods.
 */
public final class ReactiveControllerUtils {

    private static final Logger log = LoggerFactory.getLogger(ReactiveControllerUtils.class);

    private ReactiveControllerUtils() {
    }

    /**
     * Maps a value to 200, an empty source to 404 and an error to a logged 500.
     *
     * @param source body publisher
     * @param notFoundMessage error text for the 404 body
     * @param errorContext log message prefix for failures
     */
    public static <T> Mono<ResponseEntity<Object>> withErrorHandling(Mono<T> source,
                                                                    String notFoundMessage,
                                                                    String errorContext) {
        return source
            .map(body -> ResponseEntity.<Object>ok(body))
            .defaultIfEmpty(ErrorResponseUtils.error(HttpStatus.NOT_FOUND, notFoundMessage))
            .onErrorResume(ex -> {
                log.error("{}: {}", errorContext, ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
            });
    }
}
