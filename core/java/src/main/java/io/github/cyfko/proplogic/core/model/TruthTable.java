package io.github.cyfko.proplogic.core.model;

import java.util.*;

/**
 * Complete, read-only truth table of an expression.
 * <p>
 * Columns are the expression's variables in canonical (alphabetical) order. Row {@code i}
 * assigns to the {@code j}-th variable the bit {@code (i >> (k - 1 - j)) & 1}: reading the row
 * values as a binary number with the first variable as most significant bit gives the row
 * index, so rows count from all-false up to all-true and the last variable changes fastest.
 * </p>
 *
 * <h2>Storage</h2>
 * <p>
 * Results are kept in a {@link BitSet} indexed by row; value tuples are recomputed from the
 * index on demand. A table over {@code k} variables always holds exactly {@code 2^k} rows, and
 * a table over zero variables holds a single row for the empty assignment.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTable {

    private final List<Variable> variables;
    private final BitSet results;
    private final int rowCount;

    /**
     * Wraps already computed results.
     *
     * @param variables distinct variables in canonical order
     * @param results   bit {@code i} holds the result of row {@code i}; copied
     * @throws IllegalArgumentException if the variables are not strictly increasing or more than 30
     */
    public TruthTable(List<Variable> variables, BitSet results) {
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(results, "results");
        if (variables.size() > 30) {
            throw new IllegalArgumentException("A truth table supports at most 30 variables, got " + variables.size());
        }
        for (int i = 1; i < variables.size(); i++) {
            if (variables.get(i - 1).compareTo(variables.get(i)) >= 0) {
                throw new IllegalArgumentException("Variables must be distinct and sorted: " + variables);
            }
        }
        this.variables = List.copyOf(variables);
        this.rowCount = 1 << variables.size();
        this.results = results.get(0, rowCount);
    }

    /**
     * @return the columns, in canonical order
     */
    public List<Variable> variables() {
        return variables;
    }

    /**
     * @return {@code 2^k} for {@code k} variables
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * Returns the row at the given index.
     *
     * @param index row number in {@code [0, rowCount())}
     * @return the row
     */
    public Row row(int index) {
        Objects.checkIndex(index, rowCount);
        return new Row(index, variables, valuesOf(index), results.get(index));
    }

    /**
     * @return all rows in canonical order
     */
    public List<Row> rows() {
        List<Row> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return Collections.unmodifiableList(rows);
    }

    /**
     * Looks up the result for a tuple of values given in column order.
     *
     * @param values one value per variable
     * @return the expression's value under that tuple
     * @throws IllegalArgumentException if the tuple length differs from the variable count
     */
    public boolean result(List<Boolean> values) {
        Objects.requireNonNull(values, "values");
        if (values.size() != variables.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d values, got %d", variables.size(), values.size()));
        }
        int index = 0;
        for (Boolean value : values) {
            index = (index << 1) | (Objects.requireNonNull(value, "value") ? 1 : 0);
        }
        return results.get(index);
    }

    /**
     * Looks up the result for an assignment covering every column.
     *
     * @throws io.github.cyfko.proplogic.core.exception.UnboundVariableException if a column is missing
     */
    public boolean result(Assignment assignment) {
        Objects.requireNonNull(assignment, "assignment");
        int index = 0;
        for (Variable variable : variables) {
            index = (index << 1) | (assignment.valueOf(variable) ? 1 : 0);
        }
        return results.get(index);
    }

    /**
     * @return the tuple-to-result mapping, iterating in canonical row order
     */
    public Map<List<Boolean>, Boolean> asMap() {
        Map<List<Boolean>, Boolean> map = new LinkedHashMap<>(rowCount * 2);
        for (int i = 0; i < rowCount; i++) {
            map.put(valuesOf(i), results.get(i));
        }
        return Collections.unmodifiableMap(map);
    }

    public boolean isTautology() {
        return results.cardinality() == rowCount;
    }

    public boolean isContradiction() {
        return results.isEmpty();
    }

    public boolean isSatisfiable() {
        return !results.isEmpty();
    }

    /**
     * @return rows evaluating to {@code true}, in canonical order
     */
    public List<Row> satisfyingRows() {
        List<Row> rows = new ArrayList<>(results.cardinality());
        for (int i = results.nextSetBit(0); i >= 0; i = results.nextSetBit(i + 1)) {
            rows.add(row(i));
        }
        return Collections.unmodifiableList(rows);
    }

    private List<Boolean> valuesOf(int index) {
        int k = variables.size();
        Boolean[] values = new Boolean[k];
        for (int j = 0; j < k; j++) {
            values[j] = ((index >> (k - 1 - j)) & 1) == 1;
        }
        return List.of(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TruthTable that)) return false;
        return variables.equals(that.variables) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, results);
    }

    @Override
    public String toString() {
        return "TruthTable[variables=" + variables + ", rows=" + rowCount + ", true=" + results.cardinality() + "]";
    }

    /**
     * One line of the table.
     *
     * @param index     row number, equal to the values read as a binary number
     * @param variables the table's columns
     * @param values    one value per column
     * @param result    the expression's value
     */
    public record Row(int index, List<Variable> variables, List<Boolean> values, boolean result) {

        public Row {
            Objects.requireNonNull(variables, "variables");
            Objects.requireNonNull(values, "values");
            if (variables.size() != values.size()) {
                throw new IllegalArgumentException(String.format(
                        "Expected %d values, got %d", variables.size(), values.size()));
            }
        }

        /**
         * Rebuilds the assignment this row was evaluated under.
         *
         * @return the assignment
         */
        public Assignment assignment() {
            return Assignment.zip(variables, values);
        }
    }
}
