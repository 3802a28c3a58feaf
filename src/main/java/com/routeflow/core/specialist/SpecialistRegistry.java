package com.routeflow.core.specialist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup from specialist identifier to capability. Built once at
 * startup and shared by all runs.
 */
public final class SpecialistRegistry {

    private final Map<String, Specialist> specialists;

    public SpecialistRegistry(List<? extends Specialist> specialists) {
        var byId = new LinkedHashMap<String, Specialist>();
        for (Specialist specialist : specialists) {
            if (byId.putIfAbsent(specialist.id(), specialist) != null) {
                throw new IllegalArgumentException("Duplicate specialist id: " + specialist.id());
            }
        }
        this.specialists = Collections.unmodifiableMap(byId);
    }

    public Optional<Specialist> find(String id) {
        return Optional.ofNullable(specialists.get(id));
    }

    public boolean contains(String id) {
        return specialists.containsKey(id);
    }

    public List<String> ids() {
        return List.copyOf(specialists.keySet());
    }

    public int size() {
        return specialists.size();
    }
}
