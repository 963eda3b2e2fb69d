package com.payerdesk.chatbot.service.planner;

import java.util.Optional;

/**
 * Recent plans by correlation id, for inspection after a run. Lookups never fail; a lost plan reads as absent.
 */
public interface PlanStore {

    void store(String correlationId, Plan plan);

    Optional<Plan> find(String correlationId);
}
