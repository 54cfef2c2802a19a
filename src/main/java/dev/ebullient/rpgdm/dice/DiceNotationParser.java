package dev.ebullient.rpgdm.dice;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dev.ebullient.rpgdm.model.DiceSpec;
import dev.ebullient.rpgdm.model.DiceTerm;
import dev.ebullient.rpgdm.model.Keep;
import dev.ebullient.rpgdm.model.KeepMode;
import dev.ebullient.rpgdm.model.ModifierTerm;
import dev.ebullient.rpgdm.model.RollMode;
import dev.ebullient.rpgdm.model.RollTerm;

/**
 * Pure-function parser for dice notation.
 * <p>
 * Supported forms:
 * <ul>
 * <li>{@code d20}, {@code 3d8} - count defaults to 1</li>
 * <li>{@code 2d6+3}, {@code 1d20-2}, {@code 1d8+1d6+2} - constants and further dice groups</li>
 * <li>{@code 4d6kh3}, {@code 2d20kl1} - keep highest / lowest</li>
 * <li>{@code d20adv}, {@code 1d20dis+5} - advantage / disadvantage on a single die</li>
 * <li>{@code 6#4d6kh3} - roll the whole expression six times</li>
 * </ul>
 * Matching is case-insensitive and whitespace is ignored.
 */
public class DiceNotationParser {

    public static final int MAX_DICE = 1000;
    public static final int MAX_REPEAT = 100;

    private DiceNotationParser() {
    }

    public static DiceSpec parse(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new InvalidNotationException(String.valueOf(notation), 0, "empty notation");
        }
        return new Scanner(notation).parse();
    }

    /**
     * Test whether the notation parses, without throwing.
     */
    public static boolean isValid(String notation) {
        try {
            parse(notation);
            return true;
        } catch (InvalidNotationException e) {
            return false;
        }
    }

    /** Single left-to-right pass over the input; whitespace is skipped by {@link #peek()}. */
    private static class Scanner {
        final String input;
        int pos = 0;

        RollMode mode = RollMode.NORMAL;
        int rollTerms = 0;

        Scanner(String input) {
            this.input = input;
        }

        DiceSpec parse() {
            int repeat = 1;
            List<DiceTerm> terms = new ArrayList<>();

            boolean negative = accept('-');
            Integer leading = null;
            if (!negative && isDigit(peek())) {
                int start = position();
                leading = readNumber();
                if (accept('#')) {
                    if (leading < 1 || leading > MAX_REPEAT) {
                        throw fail(start, "repeat count must be between 1 and " + MAX_REPEAT);
                    }
                    repeat = leading;
                    leading = null;
                    negative = accept('-');
                }
            }
            terms.add(term(leading, negative));

            while (peek() != EOF) {
                char c = peek();
                if (c == '+' || c == '-') {
                    pos++;
                    terms.add(term(null, c == '-'));
                } else {
                    throw fail(position(), "unexpected '" + c + "'");
                }
            }

            if (rollTerms == 0) {
                throw fail(0, "no dice to roll");
            }
            if (mode != RollMode.NORMAL && rollTerms > 1) {
                throw fail(0, mode.suffix() + " requires exactly one die in the expression");
            }
            if (DiceSpec.maxMagnitude(terms) > Integer.MAX_VALUE) {
                throw fail(0, "expression total could exceed " + Integer.MAX_VALUE);
            }
            return new DiceSpec(terms, mode, repeat);
        }

        DiceTerm term(Integer leading, boolean negative) {
            int start = position();
            Integer count = leading;
            if (count == null && isDigit(peek())) {
                count = readNumber();
            }
            if (!accept('d')) {
                if (count == null) {
                    throw fail(position(), peek() == EOF ? "expected a term" : "unexpected '" + peek() + "'");
                }
                return new ModifierTerm(negative ? -count : count);
            }
            if (negative) {
                throw fail(start, "dice cannot be subtracted");
            }

            int n = count == null ? 1 : count;
            if (n < 1) {
                throw fail(start, "dice count must be at least 1");
            }
            if (n > MAX_DICE) {
                throw fail(start, "at most " + MAX_DICE + " dice can be rolled at once");
            }
            if (!isDigit(peek())) {
                throw fail(position(), "expected die size after 'd'");
            }
            int sidesAt = position();
            int sides = readNumber();
            if (sides < 2) {
                throw fail(sidesAt, "a die needs at least 2 sides");
            }

            Optional<Keep> keep = keepClause(n);
            advantageClause(n, keep.isPresent());
            rollTerms++;
            return new RollTerm(n, sides, keep);
        }

        Optional<Keep> keepClause(int count) {
            int start = position();
            if (!accept('k')) {
                return Optional.empty();
            }
            KeepMode keepMode;
            if (accept('h')) {
                keepMode = KeepMode.HIGHEST;
            } else if (accept('l')) {
                keepMode = KeepMode.LOWEST;
            } else {
                throw fail(start, "expected 'kh' or 'kl'");
            }
            if (!isDigit(peek())) {
                throw fail(position(), "expected number of dice to keep");
            }
            int n = readNumber();
            if (n < 1 || n > count) {
                throw fail(start, "cannot keep %d of %d dice".formatted(n, count));
            }
            return Optional.of(new Keep(keepMode, n));
        }

        void advantageClause(int count, boolean hasKeep) {
            int start = position();
            RollMode clause;
            if (acceptWord("adv")) {
                clause = RollMode.ADVANTAGE;
            } else if (acceptWord("dis")) {
                clause = RollMode.DISADVANTAGE;
            } else {
                return;
            }
            if (mode != RollMode.NORMAL) {
                throw fail(start, "only one advantage or disadvantage clause is allowed");
            }
            if (count != 1 || hasKeep) {
                throw fail(start, clause.suffix() + " applies to a single die without a keep clause");
            }
            mode = clause;
        }

        int readNumber() {
            int start = position();
            StringBuilder digits = new StringBuilder();
            while (isDigit(peek())) {
                digits.append(input.charAt(pos++));
            }
            try {
                return Integer.parseInt(digits.toString());
            } catch (NumberFormatException e) {
                throw fail(start, "number too large: " + digits);
            }
        }

        boolean acceptWord(String word) {
            int mark = pos;
            for (int i = 0; i < word.length(); i++) {
                if (!accept(word.charAt(i))) {
                    pos = mark;
                    return false;
                }
            }
            return true;
        }

        boolean accept(char expected) {
            if (peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        /** Lower-cased next significant character, or {@link #EOF}. Advances past whitespace. */
        char peek() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            return pos < input.length() ? Character.toLowerCase(input.charAt(pos)) : EOF;
        }

        int position() {
            peek();
            return pos;
        }

        InvalidNotationException fail(int at, String reason) {
            return new InvalidNotationException(input, at, reason);
        }

        static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }

    private static final char EOF = '\0';
}
