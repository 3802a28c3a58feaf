package com.routeflow.core.state;

import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Channel factories for the merge rules used by {@link RunState#SCHEMA}.
 */
public final class StateReducers {

    private StateReducers() {}

    /**
     * A channel that accepts one value per run. Re-writing the same value is
     * tolerated; writing a different one is an invariant violation.
     */
    public static <T> Channel<T> writeOnce(String key) {
        return Channels.base(writeOnceReducer(key));
    }

    static <T> Reducer<T> writeOnceReducer(String key) {
        return (current, next) -> {
            if (current == null || Objects.equals(current, next)) {
                return next;
            }
            throw new PipelineStateException(
                    "Field '" + key + "' is write-once and already holds a value");
        };
    }

    /**
     * A map channel merged key by key; the later write wins for a given key.
     */
    public static <V> Channel<Map<String, V>> keyed() {
        Reducer<Map<String, V>> reducer = StateReducers::mergeKeyed;
        Supplier<Map<String, V>> empty = LinkedHashMap::new;
        return Channels.base(reducer, empty);
    }

    static <V> Map<String, V> mergeKeyed(Map<String, V> current, Map<String, V> next) {
        var merged = new LinkedHashMap<String, V>();
        if (current != null) {
            merged.putAll(current);
        }
        if (next != null) {
            merged.putAll(next);
        }
        return merged;
    }
}
