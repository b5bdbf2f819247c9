package io.github.cyfko.proplogic.core.exception;

/**
 * Base class of every failure raised while tokenizing, parsing, evaluating or tabulating a formula.
 * <p>
 * All subclasses are unchecked and recoverable: the library keeps no global state, so callers may
 * simply retry with corrected input.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TruthTable table = engine.buildTruthTable(engine.parse(userInput));
 * } catch (LexException | ParseException e) {
 *     // bad formula text, report e.getMessage() to the user
 * } catch (FormulaException e) {
 *     // any other library failure
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LexException
 * @see ParseException
 * @see UnboundVariableException
 * @see ComplexityLimitException
 */
public abstract class FormulaException extends RuntimeException {

    protected FormulaException(String message) {
        super(message);
    }

    protected FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
