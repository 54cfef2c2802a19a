package dev.ebullient.rpgdm.memory;

/**
 * Capacity of a context package, in whatever unit the {@link SizeEstimator} counts.
 */
public record TokenBudget(int limit) {

    public TokenBudget {
        if (limit < 0) {
            throw new IllegalArgumentException("Budget cannot be negative: " + limit);
        }
    }

    public static TokenBudget of(int limit) {
        return new TokenBudget(limit);
    }
}
