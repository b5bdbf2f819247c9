package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.config.FormulaPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ParseException;
import io.github.cyfko.proplogic.core.model.BinaryOperator;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Token;
import io.github.cyfko.proplogic.core.model.TokenType;
import io.github.cyfko.proplogic.core.model.UnaryOperator;
import io.github.cyfko.proplogic.core.parsing.FormulaLexer;

import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent implementation of {@link FormulaParser}.
 * <p>
 * One grammar level exists per {@link BinaryOperator}, taken in declaration order (loosest
 * first); each level accepts a chain of its own operator only and folds it to the left. The
 * lowest level is {@code primary}: a negation, a variable or a parenthesized formula.
 * </p>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li><strong>Left fold</strong>: {@code A & B & C} → {@code Binary(AND, Binary(AND, A, B), C)}</li>
 *   <li><strong>Precedence</strong>: {@code A | B & C} → {@code A | (B & C)}; {@code !A & B} → {@code (!A) & B}</li>
 *   <li><strong>All-or-nothing</strong>: trailing tokens are an error, no partial tree is returned</li>
 *   <li><strong>Bounded depth</strong>: a tree whose deepest path holds more parentheses, negations
 *       and binary operators than {@link FormulaPolicy#maxNestingDepth()} is rejected with a
 *       {@link ComplexityLimitException}, so no consumer of the tree recurses past that limit</li>
 * </ul>
 *
 * <p>
 * Instances hold only their policy and may be shared between threads; the cursor over the
 * token list lives in a per-call object.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new RecursiveDescentFormulaParser();
 * Expression e = parser.parse("!(A & B) ~ C");
 *
 * // Strict configuration (for untrusted input)
 * FormulaParser strictParser = new RecursiveDescentFormulaParser(FormulaPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecursiveDescentFormulaParser implements FormulaParser {

    private static final BinaryOperator[] LEVELS = BinaryOperator.values();
    private static final String OPERAND = "variable, '!' or '('";

    private final FormulaPolicy formulaPolicy;

    /**
     * Default constructor using {@link FormulaPolicy#defaults()}.
     */
    public RecursiveDescentFormulaParser() {
        this(FormulaPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param formulaPolicy the limits to enforce
     * @throws IllegalArgumentException if the policy is null
     */
    public RecursiveDescentFormulaParser(FormulaPolicy formulaPolicy) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.formulaPolicy = formulaPolicy;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    @Override
    public Expression parse(String formula) {
        return parse(FormulaLexer.tokenize(formula, formulaPolicy));
    }

    @Override
    public Expression parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        Cursor cursor = new Cursor(tokens);
        Expression expression = cursor.binary(0).expression();
        if (!cursor.atEnd()) {
            throw new ParseException("operator or end of input", cursor.peek());
        }
        return expression;
    }

    /**
     * A parsed subtree with its nesting depth: the number of parentheses, negations and
     * binary operators on its deepest path.
     */
    private record Node(Expression expression, int depth) {}

    /**
     * Parsing state of a single {@link #parse(List)} call.
     */
    private final class Cursor {
        private final List<Token> tokens;
        private int position;
        private int open;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node binary(int level) {
            if (level == LEVELS.length) {
                return primary();
            }

            BinaryOperator op = LEVELS[level];
            Node left = binary(level + 1);
            Token operator = peek();
            while (match(op.tokenType())) {
                Node right = binary(level + 1);
                int depth = Math.max(left.depth(), right.depth()) + 1;
                checkDepth(depth, operator);
                left = new Node(Expression.binary(op, left.expression(), right.expression()), depth);
                operator = peek();
            }
            return left;
        }

        Node primary() {
            Token token = peek();
            if (token == null) {
                throw new ParseException(OPERAND, null);
            }

            switch (token.type()) {
                case VARIABLE -> {
                    position++;
                    return new Node(Expression.var(token.variable()), 0);
                }
                case NOT -> {
                    position++;
                    enter(token);
                    Node operand = primary();
                    open--;
                    int depth = operand.depth() + 1;
                    checkDepth(depth, token);
                    return new Node(new Expression.Unary(UnaryOperator.NOT, operand.expression()), depth);
                }
                case LEFT_PAREN -> {
                    position++;
                    enter(token);
                    Node inner = binary(0);
                    if (!match(TokenType.RIGHT_PAREN)) {
                        throw new ParseException("')'", peek());
                    }
                    open--;
                    int depth = inner.depth() + 1;
                    checkDepth(depth, token);
                    return new Node(inner.expression(), depth);
                }
                default -> throw new ParseException(OPERAND, token);
            }
        }

        // Open groups never exceed the depth of the subtree they will produce, so this bounds
        // the parser's own recursion before it descends.
        private void enter(Token token) {
            checkDepth(++open, token);
        }

        private void checkDepth(int depth, Token token) {
            if (depth > formulaPolicy.maxNestingDepth()) {
                throw new ComplexityLimitException(String.format(
                        "Formula nested too deeply at position %d (max depth: %d). Policy applied: %s",
                        token.position(), formulaPolicy.maxNestingDepth(), formulaPolicy.policyName()),
                        depth, formulaPolicy.maxNestingDepth());
            }
        }

        private boolean match(TokenType type) {
            Token token = peek();
            if (token != null && token.type() == type) {
                position++;
                return true;
            }
            return false;
        }

        Token peek() {
            return position < tokens.size() ? tokens.get(position) : null;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }
    }
}
