package dev.ebullient.rpgdm.memory;

/**
 * The active scene alone did not fit the budget. It was included in full anyway;
 * no older material was added.
 */
public record BudgetExhaustedWarning(String sceneId, int required, int budget) {

    public String message() {
        return "Current scene %s needs %d units, budget is %d".formatted(sceneId, required, budget);
    }
}
