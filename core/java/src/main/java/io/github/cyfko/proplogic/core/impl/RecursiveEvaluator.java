package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Evaluator;
import io.github.cyfko.proplogic.core.model.Assignment;
import io.github.cyfko.proplogic.core.model.Expression;

import java.util.Objects;

/**
 * {@link Evaluator} walking the tree recursively.
 * <p>
 * Both operands of a binary node are always evaluated, so an unbound variable is reported
 * whatever the value of the other operand.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecursiveEvaluator implements Evaluator {

    @Override
    public boolean evaluate(Expression expression, Assignment assignment) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(assignment, "assignment");
        return expression.accept(new AssignmentVisitor(assignment));
    }

    private record AssignmentVisitor(Assignment assignment) implements Expression.Visitor<Boolean> {

        @Override
        public Boolean visitVar(Expression.Var var) {
            return assignment.valueOf(var.variable());
        }

        @Override
        public Boolean visitUnary(Expression.Unary unary) {
            return unary.op().apply(unary.operand().accept(this));
        }

        @Override
        public Boolean visitBinary(Expression.Binary binary) {
            boolean left = binary.left().accept(this);
            boolean right = binary.right().accept(this);
            return binary.op().apply(left, right);
        }
    }
}
