package com.payerdesk.chatbot.service.planner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the most recent plans in this process. Oldest entries are evicted first.
 */
public class InMemoryPlanStore implements PlanStore {

    private final Map<String, Plan> plans;

    public InMemoryPlanStore(int capacity) {
        int bounded = Math.max(1, capacity);
        this.plans = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Plan> eldest) {
                return size() > bounded;
            }
        });
    }

    @Override
    public void store(String correlationId, Plan plan) {
        plans.put(correlationId, plan);
    }

    @Override
    public Optional<Plan> find(String correlationId) {
        return Optional.ofNullable(plans.get(correlationId));
    }
}
