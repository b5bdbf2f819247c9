package io.github.cyfko.proplogic.core.model;

/**
 * Binary connectives, declared from the loosest to the tightest binding.
 * <p>
 * The declaration order <strong>is</strong> the precedence table: every constant owns exactly
 * one grammar level, and all levels are left-associative.
 * </p>
 * <table border="1">
 * <caption>Binary connectives</caption>
 * <thead>
 * <tr><th>Operator</th><th>ASCII</th><th>Unicode</th><th>Precedence</th><th>False when</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Biconditional</td><td>=</td><td>↔</td><td>1</td><td>operands differ</td></tr>
 * <tr><td>Material conditional</td><td>~</td><td>→</td><td>2</td><td>left true, right false</td></tr>
 * <tr><td>Disjunction</td><td>|</td><td>∨</td><td>3</td><td>both false</td></tr>
 * <tr><td>Conjunction</td><td>&amp;</td><td>∧</td><td>4</td><td>either false</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperator {
    IFF('=', "↔", TokenType.IFF),
    IMPLIES('~', "→", TokenType.IMPLIES),
    OR('|', "∨", TokenType.OR),
    AND('&', "∧", TokenType.AND);

    private final char symbol;
    private final String unicodeSymbol;
    private final TokenType tokenType;

    BinaryOperator(char symbol, String unicodeSymbol, TokenType tokenType) {
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

    /**
     * @return the token type that introduces this operator in the source text
     */
    public TokenType tokenType() {
        return tokenType;
    }

    /**
     * @return binding strength, {@code 1} for the loosest operator
     */
    public int precedence() {
        return ordinal() + 1;
    }

    /**
     * Applies the connective to already evaluated operands.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the connective's truth value
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case IFF -> left == right;
            case IMPLIES -> !left || right;
            case OR -> left || right;
            case AND -> left && right;
        };
    }
}
