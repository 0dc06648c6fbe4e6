package com.mlbbai.hero_analysis_engine.service.analysis;

/**
 * Seam to the text-generation backend.
 */
public interface GenerativeTextClient {

    /**
     * Sends one prompt and returns the raw text reply.
     *
     * @param systemPrompt instructions for the model
     * @param userPrompt the request body
     * @return non-blank model output
     * @throws GenerativeBackendException on any transport failure or empty reply
     */
    String generate(String systemPrompt, String userPrompt);

    /**
     * @return false when no credentials are configured; callers skip straight to fallback
     */
    boolean isEnabled();
}
