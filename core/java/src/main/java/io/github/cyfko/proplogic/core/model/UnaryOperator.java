package io.github.cyfko.proplogic.core.model;

/**
 * Prefix operators. Negation binds tighter than every {@link BinaryOperator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum UnaryOperator {
    NOT('!', "¬", TokenType.NOT);

    private final char symbol;
    private final String unicodeSymbol;
    private final TokenType tokenType;

    UnaryOperator(char symbol, String unicodeSymbol, TokenType tokenType) {
        this.symbol = symbol;
        this.unicodeSymbol = unicodeSymbol;
        this.tokenType = tokenType;
    }

    public char symbol() {
        return symbol;
    }

    public String unicodeSymbol() {
        return unicodeSymbol;
    }

    public TokenType tokenType() {
        return tokenType;
    }

    /**
     * @return evaluation of the operator on its operand
     */
    public boolean apply(boolean operand) {
        return switch (this) {
            case NOT -> !operand;
        };
    }
}
