package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.model.Variable;

/**
 * Thrown when a formula is evaluated against an assignment that has no value for one of its variables.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnboundVariableException extends FormulaException {

    private final Variable variable;

    public UnboundVariableException(Variable variable) {
        super("Variable " + variable + " has no value in the assignment");
        this.variable = variable;
    }

    public Variable getVariable() {
        return variable;
    }
}
