package fr.lapetina.aiplatform.infrastructure.budget;

/**
 * Receives the cost of every served request.
 */
@FunctionalInterface
public interface CostTracker {

    void recordCost(CostRecord record);
}
