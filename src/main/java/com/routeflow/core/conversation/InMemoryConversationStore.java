package com.routeflow.core.conversation;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.model.ConversationMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local conversation history. Lost on restart.
 * <p>
 * Each session keeps at most {@code maxMessages}; older messages are dropped
 * on append.
 */
@Component
public class InMemoryConversationStore implements ConversationStore {

    static final int DEFAULT_MAX_MESSAGES = 12;

    private final ConcurrentHashMap<String, List<ConversationMessage>> sessions = new ConcurrentHashMap<>();
    private final int maxMessages;

    public InMemoryConversationStore() {
        this(DEFAULT_MAX_MESSAGES);
    }

    @Autowired
    public InMemoryConversationStore(PipelineProperties properties) {
        this(properties.getHistoryMessages() * 2);
    }

    InMemoryConversationStore(int maxMessages) {
        this.maxMessages = Math.max(1, maxMessages);
    }

    @Override
    public List<ConversationMessage> recent(String sessionId, int limit) {
        List<ConversationMessage> messages = sessions.get(sessionId);
        if (messages == null || limit <= 0) {
            return List.of();
        }
        synchronized (messages) {
            int from = Math.max(0, messages.size() - limit);
            return List.copyOf(messages.subList(from, messages.size()));
        }
    }

    @Override
    public void append(String sessionId, ConversationMessage message) {
        List<ConversationMessage> messages = sessions.computeIfAbsent(sessionId, k -> new ArrayList<>());
        synchronized (messages) {
            messages.add(message);
            int overflow = messages.size() - maxMessages;
            if (overflow > 0) {
                messages.subList(0, overflow).clear();
            }
        }
    }

    int size(String sessionId) {
        List<ConversationMessage> messages = sessions.get(sessionId);
        if (messages == null) {
            return 0;
        }
        synchronized (messages) {
            return messages.size();
        }
    }
}
