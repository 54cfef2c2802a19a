package dev.ebullient.rpgdm.dice;

/**
 * Thrown when a dice notation string cannot be parsed. The input is safe to
 * re-prompt for; nothing has been rolled.
 */
public class InvalidNotationException extends IllegalArgumentException {

    private final String notation;
    private final int position;

    public InvalidNotationException(String notation, int position, String reason) {
        super("Invalid dice notation '%s' at position %d: %s".formatted(notation, position, reason));
        this.notation = notation;
        this.position = position;
    }

    public String notation() {
        return notation;
    }

    /** Offset into the original input where parsing stopped. */
    public int position() {
        return position;
    }
}
