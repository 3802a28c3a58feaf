package com.routeflow.core.stages;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryIntentClassifierTest {

    @Test
    @DisplayName("Plain lookup questions are informational")
    void informational() {
        assertTrue(QueryIntentClassifier.isInformational("what is the budget for Quiz for January"));
        assertTrue(QueryIntentClassifier.isInformational("Show me delivery for last week"));
        assertTrue(QueryIntentClassifier.isInformational("tell me about the creatives"));
    }

    @Test
    @DisplayName("Action markers win over informational markers")
    void actionMarkersCheckedFirst() {
        assertFalse(QueryIntentClassifier.isInformational("what is the best way to fix pacing"));
        assertFalse(QueryIntentClassifier.isInformational("how is delivery, and what should we change"));
    }

    @Test
    @DisplayName("Queries without any marker are not informational")
    void noMarker() {
        assertFalse(QueryIntentClassifier.isInformational("budget"));
        assertFalse(QueryIntentClassifier.isInformational(""));
        assertFalse(QueryIntentClassifier.isInformational(null));
    }
}
