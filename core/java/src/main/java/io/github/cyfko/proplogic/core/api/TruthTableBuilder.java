package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.TruthTable;

/**
 * Enumerates every assignment of an expression's variables.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TruthTable
 */
@FunctionalInterface
public interface TruthTableBuilder {

    /**
     * Builds the complete truth table of an expression.
     *
     * @param expression the expression to tabulate
     * @return a table with {@code 2^k} rows for {@code k} distinct variables
     * @throws ComplexityLimitException if {@code k} exceeds the configured limit
     */
    TruthTable build(Expression expression) throws ComplexityLimitException;
}
