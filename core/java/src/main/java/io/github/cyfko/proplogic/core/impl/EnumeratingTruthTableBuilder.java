package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Evaluator;
import io.github.cyfko.proplogic.core.api.TruthTableBuilder;
import io.github.cyfko.proplogic.core.config.FormulaPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.model.Assignment;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.Variable;
import io.github.cyfko.proplogic.core.parsing.VariableCollector;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Brute-force {@link TruthTableBuilder}.
 * <p>
 * The expression's variables are sorted alphabetically, then a counter runs from {@code 0} to
 * {@code 2^k - 1}; bit {@code k - 1 - j} of the counter is the value of the {@code j}-th
 * variable. Each row is evaluated through the injected {@link Evaluator}.
 * </p>
 *
 * <h2>Cost</h2>
 * <p>
 * {@code O(2^k * n)} for {@code k} variables and {@code n} nodes. The variable count is checked
 * against {@link FormulaPolicy#maxVariables()} before any evaluation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EnumeratingTruthTableBuilder implements TruthTableBuilder {

    private static final Logger log = Logger.getLogger(EnumeratingTruthTableBuilder.class.getName());

    private final FormulaPolicy formulaPolicy;
    private final Evaluator evaluator;

    public EnumeratingTruthTableBuilder() {
        this(FormulaPolicy.defaults(), new RecursiveEvaluator());
    }

    /**
     * @param formulaPolicy limits to enforce
     * @param evaluator     evaluator applied to every row
     * @throws IllegalArgumentException if an argument is null
     */
    public EnumeratingTruthTableBuilder(FormulaPolicy formulaPolicy, Evaluator evaluator) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("Evaluator is required");
        }
        this.formulaPolicy = formulaPolicy;
        this.evaluator = evaluator;
    }

    @Override
    public TruthTable build(Expression expression) {
        Objects.requireNonNull(expression, "expression");

        List<Variable> variables = VariableCollector.sorted(expression);
        int k = variables.size();
        if (k > formulaPolicy.maxVariables()) {
            log.warning(() -> String.format(
                    "Refusing truth table over %d variables (max: %d, policy: %s)",
                    k, formulaPolicy.maxVariables(), formulaPolicy.policyName()));
            throw new ComplexityLimitException(String.format(
                    "Too many variables for a truth table (%d, max: %d). Policy applied: %s",
                    k, formulaPolicy.maxVariables(), formulaPolicy.policyName()),
                    k, formulaPolicy.maxVariables());
        }

        int rowCount = 1 << k;
        BitSet results = new BitSet(rowCount);
        for (int row = 0; row < rowCount; row++) {
            if (evaluator.evaluate(expression, assignmentOf(variables, row))) {
                results.set(row);
            }
        }

        log.fine(() -> String.format(
                "Built truth table over %s: %d rows, %d true", variables, rowCount, results.cardinality()));

        return new TruthTable(variables, results);
    }

    private static Assignment assignmentOf(List<Variable> variables, int row) {
        int k = variables.size();
        Assignment.Builder builder = Assignment.builder();
        for (int j = 0; j < k; j++) {
            builder.set(variables.get(j), ((row >> (k - 1 - j)) & 1) == 1);
        }
        return builder.build();
    }
}
