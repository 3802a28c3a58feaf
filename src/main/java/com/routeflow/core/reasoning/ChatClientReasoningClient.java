package com.routeflow.core.reasoning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link ReasoningClient} backed by Spring AI's {@link ChatClient}.
 */
@Service
public class ChatClientReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientReasoningClient.class);

    private static final String SYSTEM_PROMPT = """
            You are part of an analysis system for programmatic advertising campaigns.
            Follow the requested output format exactly and do not add commentary outside it.
            """;

    private final ChatClient chatClient;

    public ChatClientReasoningClient(ChatClient.Builder builder,
                                     @Value("${spring.ai.openai.chat.options.model:NOT_SET}") String model) {
        this.chatClient = builder.defaultSystem(SYSTEM_PROMPT).build();
        log.info("Reasoning client initialized, model: {}", model);
    }

    @Override
    public String complete(String prompt) {
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .user(prompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Reasoning call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new ReasoningEmptyResponseException(
                    "Model returned empty content. Check that the model is reachable and configured.");
        }
        return response;
    }
}
