package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.UnboundVariableException;

import java.util.*;

/**
 * Immutable valuation of a finite set of {@link Variable}s.
 * <p>
 * An assignment is stored as two 26-bit masks: the variables it binds and the ones bound to
 * {@code true}. It is therefore cheap to create once per truth-table row.
 * </p>
 *
 * <pre>{@code
 * Assignment a = Assignment.builder().set('A', true).set('B', false).build();
 * a.valueOf(Variable.of('A')); // true
 * a.valueOf(Variable.of('C')); // throws UnboundVariableException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(0, 0);

    private final int boundMask;
    private final int trueMask;

    private Assignment(int boundMask, int trueMask) {
        this.boundMask = boundMask;
        this.trueMask = trueMask & boundMask;
    }

    /**
     * @return the assignment binding no variable
     */
    public static Assignment empty() {
        return EMPTY;
    }

    /**
     * Copies a map into an assignment.
     *
     * @param values variable values, neither keys nor values may be {@code null}
     * @return the assignment
     */
    public static Assignment of(Map<Variable, Boolean> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        values.forEach((variable, value) -> builder.set(variable, Objects.requireNonNull(value, "value")));
        return builder.build();
    }

    /**
     * Pairs variables with values position by position.
     *
     * @param variables distinct variables
     * @param values    one value per variable
     * @return the assignment
     * @throws IllegalArgumentException if sizes differ or a variable repeats
     */
    public static Assignment zip(List<Variable> variables, List<Boolean> values) {
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(values, "values");
        if (variables.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d values, got %d", variables.size(), values.size()));
        }
        Builder builder = builder();
        for (int i = 0; i < variables.size(); i++) {
            Variable variable = Objects.requireNonNull(variables.get(i), "variable");
            if (builder.binds(variable)) {
                throw new IllegalArgumentException("Duplicate variable " + variable);
            }
            builder.set(variable, Objects.requireNonNull(values.get(i), "value"));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the value bound to a variable.
     *
     * @param variable the variable to look up
     * @return its value
     * @throws UnboundVariableException if the variable has no value
     */
    public boolean valueOf(Variable variable) {
        Objects.requireNonNull(variable, "variable");
        int bit = 1 << variable.index();
        if ((boundMask & bit) == 0) {
            throw new UnboundVariableException(variable);
        }
        return (trueMask & bit) != 0;
    }

    public boolean binds(Variable variable) {
        return (boundMask & (1 << variable.index())) != 0;
    }

    /**
     * @return bound variables in canonical order
     */
    public SortedSet<Variable> variables() {
        SortedSet<Variable> result = new TreeSet<>();
        for (int i = 0; i < Variable.ALPHABET_SIZE; i++) {
            if ((boundMask & (1 << i)) != 0) {
                result.add(Variable.ofIndex(i));
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    public int size() {
        return Integer.bitCount(boundMask);
    }

    /**
     * @return a sorted, unmodifiable view of this assignment as a map
     */
    public SortedMap<Variable, Boolean> asMap() {
        SortedMap<Variable, Boolean> result = new TreeMap<>();
        for (Variable variable : variables()) {
            result.put(variable, valueOf(variable));
        }
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment that)) return false;
        return boundMask == that.boundMask && trueMask == that.trueMask;
    }

    @Override
    public int hashCode() {
        return 31 * boundMask + trueMask;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        asMap().forEach((variable, value) -> joiner.add(variable + "=" + (value ? 1 : 0)));
        return joiner.toString();
    }

    /**
     * Mutable builder; the last value set for a variable wins.
     */
    public static final class Builder {
        private int boundMask;
        private int trueMask;

        private Builder() {}

        public Builder set(Variable variable, boolean value) {
            Objects.requireNonNull(variable, "variable");
            int bit = 1 << variable.index();
            boundMask |= bit;
            trueMask = value ? trueMask | bit : trueMask & ~bit;
            return this;
        }

        public Builder set(char letter, boolean value) {
            return set(Variable.of(letter), value);
        }

        boolean binds(Variable variable) {
            return (boundMask & (1 << variable.index())) != 0;
        }

        public Assignment build() {
            return boundMask == 0 ? EMPTY : new Assignment(boundMask, trueMask);
        }
    }
}
