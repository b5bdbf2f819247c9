package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.model.Token;

/**
 * Thrown when a token sequence does not form exactly one well-formed formula.
 * <p>
 * The exception records what the parser expected and the token it found instead; a
 * {@code null} {@link #getFound() found} token means the input ended prematurely.
 * </p>
 *
 * <p><strong>Typical messages:</strong></p>
 * <pre>
 * "A &amp;"     → Expected variable, '!' or '(' but reached end of input
 * "(A &amp; B"  → Expected ')' but reached end of input
 * "A B"     → Expected end of input but found 'B' at position 2
 * "A &amp; )"   → Expected variable, '!' or '(' but found ')' at position 4
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParseException extends FormulaException {

    private final String expected;
    private final Token found;

    /**
     * @param expected human-readable description of the acceptable input
     * @param found    the offending token, or {@code null} at end of input
     */
    public ParseException(String expected, Token found) {
        super("Expected " + expected + " but " + (found == null ? "reached end of input" : "found " + found));
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    /**
     * @return the unexpected token, {@code null} when input ended early
     */
    public Token getFound() {
        return found;
    }

    /**
     * @return position of the offending token, or {@code -1} at end of input
     */
    public int getPosition() {
        return found == null ? -1 : found.position();
    }

    /**
     * @return {@code true} if the input ended while more tokens were required
     */
    public boolean isEndOfInput() {
        return found == null;
    }
}
