package com.mlbbai.hero_analysis_engine.service.provider.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlbbai.hero_analysis_engine.model.Hero;

import java.util.List;
import java.util.Optional;

/**
 * One strategy for reading heroes out of a provider response.
 * Implementations are total: malformed input yields no rows or an empty
 * Optional, never an exception.
 */
public interface HeroListSource {

    /**
     * @return short strategy name used in logs
     */
    String name();

    /**
     * @return provider path this strategy reads, relative to the base URL
     */
    String path();

    List<JsonNode> extractRows(JsonNode response);

    Optional<Hero> adapt(JsonNode row);
}
