/**
 * Configuration for the generative text backend
 *
 * @author William Callahan
 *
 * Features:
 * - Builds the OpenAI chat model explicitly from app.analysis.* (auto-configuration is not used)
 * - Bounds every backend call with app.analysis.timeout
 * - Disables Spring AI's internal retries; the analysis retry template owns retry policy
 * - Falls back to a disabled client when no API key is configured
 */
package com.mlbbai.hero_analysis_engine.config;

import com.mlbbai.hero_analysis_engine.service.analysis.GenerativeTextClient;
import com.mlbbai.hero_analysis_engine.service.analysis.SpringAiGenerativeTextClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class GenerativeModelConfig {

    private static final Logger logger = LoggerFactory.getLogger(GenerativeModelConfig.class);

    @Bean
    public GenerativeTextClient generativeTextClient(HeroEngineProperties properties) {
        HeroEngineProperties.Analysis analysis = properties.getAnalysis();
        if (!analysis.isEnabled()) {
            logger.warn("No generative API key configured (app.analysis.api-key); analyses will use templated fallbacks.");
            return SpringAiGenerativeTextClient.disabled();
        }

        Duration timeout = analysis.getTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) Math.min(timeout.toMillis(), Integer.MAX_VALUE));
        requestFactory.setReadTimeout((int) Math.min(timeout.toMillis(), Integer.MAX_VALUE));

        OpenAiApi openAiApi = OpenAiApi.builder()
            .baseUrl(analysis.getBaseUrl())
            .apiKey(analysis.getApiKey())
            .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
            .build();

        OpenAiChatModel chatModel = OpenAiChatModel.builder()
            .openAiApi(openAiApi)
            .defaultOptions(OpenAiChatOptions.builder()
                .model(analysis.getModel())
                .maxTokens(analysis.getMaxTokens())
                .build())
            .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
            .build();

        logger.info("Generative backend enabled: model={}, baseUrl={}, timeout={}",
            analysis.getModel(), analysis.getBaseUrl(), timeout);
        return new SpringAiGenerativeTextClient(ChatClient.create(chatModel));
    }
}
