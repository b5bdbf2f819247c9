package io.github.cyfko.proplogic.core.exception;

/**
 * Thrown when an input exceeds one of the limits of the active
 * {@link io.github.cyfko.proplogic.core.config.FormulaPolicy}, such as the number of variables a
 * truth table may enumerate.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ComplexityLimitException extends FormulaException {

    private final int actual;
    private final int limit;

    public ComplexityLimitException(String message, int actual, int limit) {
        super(message);
        this.actual = actual;
        this.limit = limit;
    }

    public int getActual() {
        return actual;
    }

    public int getLimit() {
        return limit;
    }
}
