package com.arenasync.source;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public final class Conditions {
    private Conditions() {
    }

    /**
     * Sets a condition keyed by {@code type}. An existing entry keeps its position and only
     * moves its transition time when the status flips; otherwise the condition is appended.
     */
    public static void set(
            List<Condition> conditions,
            long generation,
            String type,
            ConditionStatus status,
            String reason,
            String message,
            Instant now) {
        for (int i = 0; i < conditions.size(); i++) {
            Condition existing = conditions.get(i);
            if (existing.type().equals(type)) {
                Instant transition = existing.status() == status && existing.lastTransitionTime() != null
                        ? existing.lastTransitionTime()
                        : now;
                conditions.set(i, new Condition(type, status, reason, message, generation, transition));
                return;
            }
        }
        conditions.add(new Condition(type, status, reason, message, generation, now));
    }

    public static Optional<Condition> find(List<Condition> conditions, String type) {
        return conditions.stream()
                .filter(condition -> condition.type().equals(type))
                .findFirst();
    }
}
