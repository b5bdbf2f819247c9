package io.github.cyfko.proplogic.core.format;

import io.github.cyfko.proplogic.core.model.Expression;

import java.util.Objects;

/**
 * Writes an expression as canonical formula text.
 * <p>
 * Only the parentheses the grammar needs are emitted:
 * </p>
 * <ul>
 *   <li>a binary operand binding looser than its parent is parenthesized</li>
 *   <li>the right operand is also parenthesized when it binds as tightly as its parent,
 *       since chains fold to the left</li>
 *   <li>a negated binary node is written {@code !(...)}; a negated variable or negation is not wrapped</li>
 * </ul>
 * <p>
 * Binary operators are surrounded by one space. In {@link Notation#ASCII} the output parses
 * back to an equal tree, and {@code format(parse(s)).equals(s)} holds for any formula
 * {@code s} written this way.
 * </p>
 *
 * <pre>{@code
 * ExpressionFormatter.format(parser.parse("a|(b&c)"));                   // "A | B & C"
 * ExpressionFormatter.format(parser.parse("!(A ~ B)"), Notation.UNICODE); // "¬(A → B)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {}

    public static String format(Expression expression) {
        return format(expression, Notation.ASCII);
    }

    public static String format(Expression expression, Notation notation) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(notation, "notation");
        StringBuilder out = new StringBuilder();
        expression.accept(new Writer(out, notation));
        return out.toString();
    }

    private record Writer(StringBuilder out, Notation notation) implements Expression.Visitor<Void> {

        @Override
        public Void visitVar(Expression.Var var) {
            out.append(var.variable().letter());
            return null;
        }

        @Override
        public Void visitUnary(Expression.Unary unary) {
            out.append(notation.symbolOf(unary.op()));
            writeOperand(unary.operand(), unary.operand() instanceof Expression.Binary);
            return null;
        }

        @Override
        public Void visitBinary(Expression.Binary binary) {
            int precedence = binary.op().precedence();
            writeOperand(binary.left(), precedenceOf(binary.left()) < precedence);
            out.append(' ').append(notation.symbolOf(binary.op())).append(' ');
            writeOperand(binary.right(), precedenceOf(binary.right()) <= precedence);
            return null;
        }

        private void writeOperand(Expression operand, boolean parenthesize) {
            if (parenthesize) {
                out.append('(');
                operand.accept(this);
                out.append(')');
            } else {
                operand.accept(this);
            }
        }

        // Leaves and negations bind tighter than any binary operator.
        private static int precedenceOf(Expression expression) {
            return expression instanceof Expression.Binary binary ? binary.op().precedence() : Integer.MAX_VALUE;
        }
    }
}
