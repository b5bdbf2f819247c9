package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Variable;

import java.util.*;

/**
 * Collects the free variables of an expression.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableCollector {

    private VariableCollector() {}

    /**
     * Returns every variable the expression references, without duplicates.
     * <p>
     * The set iterates in alphabetical order, but callers that need the canonical column order
     * should use {@link #sorted(Expression)}.
     * </p>
     *
     * @param expression the expression to scan
     * @return an unmodifiable set of variables
     */
    public static Set<Variable> collect(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        SortedSet<Variable> variables = new TreeSet<>();
        expression.accept(new Expression.Visitor<Void>() {
            @Override
            public Void visitVar(Expression.Var var) {
                variables.add(var.variable());
                return null;
            }

            @Override
            public Void visitUnary(Expression.Unary unary) {
                return unary.operand().accept(this);
            }

            @Override
            public Void visitBinary(Expression.Binary binary) {
                binary.left().accept(this);
                return binary.right().accept(this);
            }
        });
        return Collections.unmodifiableSortedSet(variables);
    }

    /**
     * @return the expression's variables in canonical (alphabetical) order
     */
    public static List<Variable> sorted(Expression expression) {
        return List.copyOf(collect(expression));
    }
}
