package dev.ebullient.rpgdm.memory;

/**
 * Estimates how much of a {@link TokenBudget} a piece of context text uses.
 * The counting scheme is up to the caller; estimates must never be negative.
 */
@FunctionalInterface
public interface SizeEstimator {

    int estimate(String text);

    /** One unit per character. */
    SizeEstimator CHARACTERS = String::length;

    /** One unit per whitespace-separated word. */
    SizeEstimator WORDS = text -> text.isBlank() ? 0 : text.trim().split("\\s+").length;
}
