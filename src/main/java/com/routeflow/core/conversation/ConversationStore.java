package com.routeflow.core.conversation;

import com.routeflow.core.model.ConversationMessage;

import java.util.List;

/**
 * Per-session message history used to give routing conversational context.
 */
public interface ConversationStore {

    /**
     * @return up to {@code limit} most recent messages, oldest first
     */
    List<ConversationMessage> recent(String sessionId, int limit);

    void append(String sessionId, ConversationMessage message);
}
