package io.github.cyfko.proplogic.core.model;

/**
 * A propositional atom named by a single uppercase letter {@code A}..{@code Z}.
 * <p>
 * Variables are immutable values identified by their alphabetic index (0 for {@code A},
 * 25 for {@code Z}). The natural ordering follows the alphabet and is the canonical order
 * used for a formula's variable set and for truth-table columns.
 * </p>
 *
 * <pre>{@code
 * Variable a = Variable.of('a');     // canonical 'A'
 * Variable z = Variable.ofIndex(25); // 'Z'
 * a.compareTo(z) < 0;                // true
 * }</pre>
 *
 * @param index alphabetic index in {@code [0, 25]}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(int index) implements Comparable<Variable> {

    /**
     * Number of distinct variables.
     */
    public static final int ALPHABET_SIZE = 26;

    private static final Variable[] ALL = new Variable[ALPHABET_SIZE];

    static {
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            ALL[i] = new Variable(i);
        }
    }

    /**
     * Canonical constructor with bounds checking.
     *
     * @throws IllegalArgumentException if the index is outside {@code [0, 25]}
     */
    public Variable {
        if (index < 0 || index >= ALPHABET_SIZE) {
            throw new IllegalArgumentException("Variable index must be in [0, 25], got: " + index);
        }
    }

    /**
     * Returns the variable named by the given ASCII letter, in either case.
     *
     * @param letter an ASCII letter
     * @return the variable
     * @throws IllegalArgumentException if {@code letter} is not an ASCII letter
     */
    public static Variable of(char letter) {
        if (!isLetter(letter)) {
            throw new IllegalArgumentException("Invalid variable letter '" + letter + "'");
        }
        return ALL[Character.toUpperCase(letter) - 'A'];
    }

    /**
     * Returns the variable at the given alphabetic index.
     *
     * @param index index in {@code [0, 25]}
     * @return the variable
     * @throws IllegalArgumentException if the index is out of range
     */
    public static Variable ofIndex(int index) {
        if (index < 0 || index >= ALPHABET_SIZE) {
            throw new IllegalArgumentException("Variable index must be in [0, 25], got: " + index);
        }
        return ALL[index];
    }

    /**
     * Tells whether a character can name a variable.
     *
     * @param c the character to test
     * @return {@code true} for {@code a-z} and {@code A-Z}
     */
    public static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    /**
     * @return the uppercase letter naming this variable
     */
    public char letter() {
        return (char) ('A' + index);
    }

    @Override
    public int compareTo(Variable other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return String.valueOf(letter());
    }
}
