package com.routeflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the analysis pipeline, bound from {@code routeflow.pipeline.*}.
 */
@Component
@ConfigurationProperties(prefix = "routeflow.pipeline")
public class PipelineProperties {

    /** Overall budget for one run, from routing to response. */
    private Duration runTimeout = Duration.ofSeconds(60);

    /** Budget for a single specialist call, nested inside the run budget. */
    private Duration specialistTimeout = Duration.ofSeconds(30);

    private int maxSpecialists = 3;

    /** Routing confidence below this asks the user to clarify. */
    private double clarificationThreshold = 0.3;

    private int minQueryTokens = 3;

    /** Short queries are blocked at the gate when routing confidence is below this. */
    private double shortQueryBlockConfidence = 0.6;

    private double lowConfidenceWarning = 0.4;

    private int maxRecommendations = 7;

    private int historyMessages = 6;

    private int historyMessageChars = 300;

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    public Duration getSpecialistTimeout() {
        return specialistTimeout;
    }

    public void setSpecialistTimeout(Duration specialistTimeout) {
        this.specialistTimeout = specialistTimeout;
    }

    public int getMaxSpecialists() {
        return maxSpecialists;
    }

    public void setMaxSpecialists(int maxSpecialists) {
        this.maxSpecialists = maxSpecialists;
    }

    public double getClarificationThreshold() {
        return clarificationThreshold;
    }

    public void setClarificationThreshold(double clarificationThreshold) {
        this.clarificationThreshold = clarificationThreshold;
    }

    public int getMinQueryTokens() {
        return minQueryTokens;
    }

    public void setMinQueryTokens(int minQueryTokens) {
        this.minQueryTokens = minQueryTokens;
    }

    public double getShortQueryBlockConfidence() {
        return shortQueryBlockConfidence;
    }

    public void setShortQueryBlockConfidence(double shortQueryBlockConfidence) {
        this.shortQueryBlockConfidence = shortQueryBlockConfidence;
    }

    public double getLowConfidenceWarning() {
        return lowConfidenceWarning;
    }

    public void setLowConfidenceWarning(double lowConfidenceWarning) {
        this.lowConfidenceWarning = lowConfidenceWarning;
    }

    public int getMaxRecommendations() {
        return maxRecommendations;
    }

    public void setMaxRecommendations(int maxRecommendations) {
        this.maxRecommendations = maxRecommendations;
    }

    public int getHistoryMessages() {
        return historyMessages;
    }

    public void setHistoryMessages(int historyMessages) {
        this.historyMessages = historyMessages;
    }

    public int getHistoryMessageChars() {
        return historyMessageChars;
    }

    public void setHistoryMessageChars(int historyMessageChars) {
        this.historyMessageChars = historyMessageChars;
    }
}
