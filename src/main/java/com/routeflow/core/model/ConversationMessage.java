package com.routeflow.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One turn of a stored conversation.
 *
 * @param role      "user" or "assistant"
 * @param content   message text
 * @param timestamp when the message was recorded
 */
public record ConversationMessage(
    String role,
    String content,
    Instant timestamp
) implements Serializable {

    public static ConversationMessage user(String content) {
        return new ConversationMessage("user", content, Instant.now());
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage("assistant", content, Instant.now());
    }
}
