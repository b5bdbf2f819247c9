package io.github.cyfko.proplogic.core.exception;

/**
 * Thrown when formula text contains a character that is neither whitespace, an ASCII letter,
 * an operator nor a parenthesis.
 * <p>
 * Example: {@code "A & 3"} → {@code "Invalid character '3' at position 4"}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends FormulaException {

    private final int codePoint;
    private final int position;

    /**
     * @param codePoint the offending character
     * @param position  zero-based offset of the character in the input
     */
    public LexException(int codePoint, int position) {
        super(String.format("Invalid character '%s' at position %d", new String(Character.toChars(codePoint)), position));
        this.codePoint = codePoint;
        this.position = position;
    }

    /**
     * @return the offending code point
     */
    public int getCodePoint() {
        return codePoint;
    }

    /**
     * @return the offending character as a string
     */
    public String getCharacter() {
        return new String(Character.toChars(codePoint));
    }

    /**
     * @return zero-based position of the character
     */
    public int getPosition() {
        return position;
    }
}
