package com.mlbbai.hero_analysis_engine.service.analysis;

import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link GenerativeTextClient} backed by a Spring AI {@link ChatClient}.
 * A null client means the backend is disabled.
 */
@Slf4j
public class SpringAiGenerativeTextClient implements GenerativeTextClient {

    private final ChatClient chatClient;

    public SpringAiGenerativeTextClient(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    public static SpringAiGenerativeTextClient disabled() {
        return new SpringAiGenerativeTextClient(null);
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        if (chatClient == null) {
            throw new GenerativeBackendException("Generative backend is not configured");
        }
        String content;
        try {
            content = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        } catch (RuntimeException ex) {
            throw new GenerativeBackendException("Generative backend call failed: " + ex.getMessage(), ex);
        }
        if (!ValidationUtils.hasText(content)) {
            throw new GenerativeBackendException("Generative backend returned empty content");
        }
        log.debug("Generative backend returned {} chars", content.length());
        return content;
    }

    @Override
    public boolean isEnabled() {
        return chatClient != null;
    }
}
