package com.routeflow.core.reasoning;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient JSON parsing of model replies into records.
 * <p>
 * Strips markdown code fences and any prose around the outermost JSON
 * object before handing the text to Jackson.
 */
public final class ReasoningParser {

    private static final Logger log = LoggerFactory.getLogger(ReasoningParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private static final Pattern NUMBER = Pattern.compile("(-?)(\\d*\\.?\\d+)\\s*(%?)");

    private ReasoningParser() {}

    /**
     * Reads the first number in a free-text confidence value, e.g. {@code "0.85."},
     * {@code "85%"} or {@code "about 0.7"}. Percentages are scaled to [0,1] and the
     * result is clamped to that range.
     */
    public static double confidence(String raw, double defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        Matcher m = NUMBER.matcher(raw);
        if (!m.find()) {
            return defaultValue;
        }
        double value = Double.parseDouble(m.group(2));
        if (!m.group(3).isEmpty()) {
            value = value / 100.0;
        }
        if (!m.group(1).isEmpty()) {
            value = -value;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static <T> T parse(String text, Class<T> outputType) {
        if (text == null || text.isBlank()) {
            throw new ReasoningParseException("Empty reply, expected " + outputType.getSimpleName());
        }
        String cleaned = extractJson(text);
        try {
            return MAPPER.readValue(cleaned, outputType);
        } catch (Exception e) {
            log.debug("Raw model reply: {}", text);
            throw new ReasoningParseException("Failed to parse model reply to "
                    + outputType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    static String extractJson(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned.trim();
    }
}
