package io.github.cyfko.proplogic.core.model;

/**
 * Kinds of lexical tokens in a formula.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    VARIABLE(null),
    NOT('!'),
    AND('&'),
    OR('|'),
    IMPLIES('~'),
    IFF('='),
    LEFT_PAREN('('),
    RIGHT_PAREN(')');

    private final Character symbol;

    TokenType(Character symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the fixed source character of this token type, or {@code null} for {@link #VARIABLE}
     */
    public Character symbol() {
        return symbol;
    }

    /**
     * Looks up the token type produced by a punctuation character.
     *
     * @param c the character
     * @return the matching type, or {@code null} if {@code c} is not an operator or parenthesis
     */
    public static TokenType forSymbol(char c) {
        return switch (c) {
            case '!' -> NOT;
            case '&' -> AND;
            case '|' -> OR;
            case '~' -> IMPLIES;
            case '=' -> IFF;
            case '(' -> LEFT_PAREN;
            case ')' -> RIGHT_PAREN;
            default -> null;
        };
    }
}
