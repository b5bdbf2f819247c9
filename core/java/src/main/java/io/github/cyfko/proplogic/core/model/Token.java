package io.github.cyfko.proplogic.core.model;

import java.util.Objects;

/**
 * A lexical token with its zero-based position in the source formula.
 * <p>
 * {@link #variable()} is set for {@link TokenType#VARIABLE} tokens only.
 * </p>
 *
 * @param type     the token kind
 * @param variable the variable for {@code VARIABLE} tokens, {@code null} otherwise
 * @param position zero-based character offset in the source text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, Variable variable, int position) {

    public Token {
        Objects.requireNonNull(type, "Token type is required");
        if ((type == TokenType.VARIABLE) != (variable != null)) {
            throw new IllegalArgumentException("A variable is required for, and only for, VARIABLE tokens");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Token position must not be negative, got: " + position);
        }
    }

    public static Token variable(Variable variable, int position) {
        return new Token(TokenType.VARIABLE, Objects.requireNonNull(variable, "variable"), position);
    }

    public static Token symbol(TokenType type, int position) {
        if (type == TokenType.VARIABLE) {
            throw new IllegalArgumentException("Use Token.variable(...) for variable tokens");
        }
        return new Token(type, null, position);
    }

    /**
     * @return the source text of this token
     */
    public String text() {
        return type == TokenType.VARIABLE ? variable.toString() : String.valueOf(type.symbol());
    }

    @Override
    public String toString() {
        return "'" + text() + "' at position " + position;
    }
}
