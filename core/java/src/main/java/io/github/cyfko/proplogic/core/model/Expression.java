package io.github.cyfko.proplogic.core.model;

import java.util.Objects;

/**
 * Immutable syntax tree of a propositional formula.
 * <p>
 * The hierarchy is closed: {@link Var} leaves, {@link Unary} and {@link Binary} nodes.
 * Consumers walk it through {@link Visitor}, so a new variant cannot be added without
 * every consumer being updated.
 * </p>
 *
 * <pre>{@code
 * // (!A) & B
 * Expression e = Expression.binary(BinaryOperator.AND,
 *         Expression.not(Expression.var('A')),
 *         Expression.var('B'));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Expression.Var, Expression.Unary, Expression.Binary {

    <R> R accept(Visitor<R> visitor);

    static Var var(char letter) {
        return new Var(Variable.of(letter));
    }

    static Var var(Variable variable) {
        return new Var(variable);
    }

    static Unary not(Expression operand) {
        return new Unary(UnaryOperator.NOT, operand);
    }

    static Binary binary(BinaryOperator op, Expression left, Expression right) {
        return new Binary(op, left, right);
    }

    /**
     * Leaf holding a variable.
     */
    record Var(Variable variable) implements Expression {
        public Var {
            Objects.requireNonNull(variable, "variable");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    /**
     * Prefix operator applied to one operand.
     */
    record Unary(UnaryOperator op, Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Binary connective. Chains of the same operator nest on the left.
     */
    record Binary(BinaryOperator op, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * Exhaustive visitor over the expression variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitVar(Var var);

        R visitUnary(Unary unary);

        R visitBinary(Binary binary);
    }
}
