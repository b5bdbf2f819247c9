package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.UnboundVariableException;
import io.github.cyfko.proplogic.core.model.Assignment;
import io.github.cyfko.proplogic.core.model.Expression;

/**
 * Computes the truth value of an expression under an assignment.
 * <p>
 * Implementations must be pure: the same inputs always give the same result, and concurrent
 * calls need no synchronization.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * @param expression the expression to evaluate
     * @param assignment values for (at least) every variable of the expression
     * @return the expression's truth value
     * @throws UnboundVariableException if the expression references a variable the assignment lacks
     */
    boolean evaluate(Expression expression, Assignment assignment) throws UnboundVariableException;
}
