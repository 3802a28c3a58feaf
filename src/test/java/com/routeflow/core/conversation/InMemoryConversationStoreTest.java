package com.routeflow.core.conversation;

import com.routeflow.core.config.PipelineProperties;
import com.routeflow.core.model.ConversationMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConversationStoreTest {

    private final InMemoryConversationStore store = new InMemoryConversationStore();

    @Test
    @DisplayName("recent returns the newest messages in chronological order")
    void recentKeepsOrder() {
        for (int i = 1; i <= 5; i++) {
            store.append("s1", ConversationMessage.user("q" + i));
        }

        var recent = store.recent("s1", 2);

        assertEquals(2, recent.size());
        assertEquals("q4", recent.get(0).content());
        assertEquals("q5", recent.get(1).content());
    }

    @Test
    @DisplayName("sessions are isolated and unknown sessions are empty")
    void sessionsIsolated() {
        store.append("s1", ConversationMessage.user("hello"));

        assertTrue(store.recent("s2", 6).isEmpty());
        assertTrue(store.recent("s1", 0).isEmpty());
        assertEquals(1, store.recent("s1", 6).size());
    }

    @Test
    @DisplayName("returned history is a snapshot")
    void snapshot() {
        store.append("s1", ConversationMessage.user("one"));
        var before = store.recent("s1", 6);
        store.append("s1", ConversationMessage.assistant("two"));

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(ConversationMessage.user("x")));
    }

    @Test
    @DisplayName("append drops the oldest messages past the session cap")
    void sessionCapped() {
        var capped = new InMemoryConversationStore(4);
        for (int i = 1; i <= 10; i++) {
            capped.append("s1", ConversationMessage.user("q" + i));
        }

        assertEquals(4, capped.size("s1"));
        var recent = capped.recent("s1", 10);
        assertEquals(4, recent.size());
        assertEquals("q7", recent.get(0).content());
        assertEquals("q10", recent.get(3).content());
    }

    @Test
    @DisplayName("the session cap is twice the configured history window")
    void capFollowsHistoryWindow() {
        var properties = new PipelineProperties();
        properties.setHistoryMessages(2);
        var configured = new InMemoryConversationStore(properties);
        for (int i = 1; i <= 9; i++) {
            configured.append("s1", ConversationMessage.assistant("a" + i));
        }

        assertEquals(4, configured.size("s1"));
        assertEquals("a6", configured.recent("s1", 4).get(0).content());
    }
}
