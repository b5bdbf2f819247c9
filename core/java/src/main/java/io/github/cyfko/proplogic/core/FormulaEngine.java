package io.github.cyfko.proplogic.core;

import io.github.cyfko.proplogic.core.api.Evaluator;
import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.api.TruthTableBuilder;
import io.github.cyfko.proplogic.core.config.FormulaPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.LexException;
import io.github.cyfko.proplogic.core.exception.ParseException;
import io.github.cyfko.proplogic.core.exception.UnboundVariableException;
import io.github.cyfko.proplogic.core.format.ExpressionFormatter;
import io.github.cyfko.proplogic.core.format.Notation;
import io.github.cyfko.proplogic.core.impl.EnumeratingTruthTableBuilder;
import io.github.cyfko.proplogic.core.impl.RecursiveDescentFormulaParser;
import io.github.cyfko.proplogic.core.impl.RecursiveEvaluator;
import io.github.cyfko.proplogic.core.model.Assignment;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Token;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.parsing.FormulaLexer;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade over the formula pipeline.
 * <p>
 * {@code text → tokenize → parse → Expression → evaluate | buildTruthTable}
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * FormulaEngine engine = FormulaEngine.of(FormulaPolicy.strict());
 *
 * Expression e = engine.parse("(A ~ B) & A ~ B");
 *
 * boolean value = engine.evaluate(e, Assignment.builder().set('A', true).set('B', false).build());
 *
 * TruthTable table = engine.buildTruthTable(e);
 * table.isTautology(); // true, modus ponens
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link LexException} - invalid character in the formula</li>
 *   <li>{@link ParseException} - malformed formula</li>
 *   <li>{@link UnboundVariableException} - incomplete assignment</li>
 *   <li>{@link ComplexityLimitException} - formula or truth table beyond the policy limits</li>
 * </ul>
 *
 * <p>Engines keep no state besides their collaborators and are safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaEngine {

    private static final Logger log = Logger.getLogger(FormulaEngine.class.getName());

    private final FormulaPolicy formulaPolicy;
    private final FormulaParser parser;
    private final Evaluator evaluator;
    private final TruthTableBuilder truthTableBuilder;

    private FormulaEngine(FormulaPolicy formulaPolicy, FormulaParser parser, Evaluator evaluator,
                          TruthTableBuilder truthTableBuilder) {
        this.formulaPolicy = Objects.requireNonNull(formulaPolicy, "Formula policy is required");
        this.parser = Objects.requireNonNull(parser, "Parser is required");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator is required");
        this.truthTableBuilder = Objects.requireNonNull(truthTableBuilder, "Truth table builder is required");
    }

    /**
     * @return an engine using {@link FormulaPolicy#defaults()}
     */
    public static FormulaEngine of() {
        return of(FormulaPolicy.defaults());
    }

    /**
     * Creates an engine with the default parser and evaluator under the given policy.
     *
     * @param formulaPolicy limits to enforce
     * @return the engine
     * @throws NullPointerException if the policy is null
     */
    public static FormulaEngine of(FormulaPolicy formulaPolicy) {
        Objects.requireNonNull(formulaPolicy, "Formula policy is required");
        Evaluator evaluator = new RecursiveEvaluator();
        return new FormulaEngine(formulaPolicy,
                new RecursiveDescentFormulaParser(formulaPolicy),
                evaluator,
                new EnumeratingTruthTableBuilder(formulaPolicy, evaluator));
    }

    /**
     * Creates an engine with custom collaborators.
     *
     * @param formulaPolicy limits applied by {@link #tokenize(String)}
     * @param parser        parser used by {@link #parse(String)} and {@link #parse(List)}
     * @param evaluator     evaluator used by {@link #evaluate(Expression, Assignment)}
     * @param truthTableBuilder builder used by {@link #buildTruthTable(Expression)}
     * @return the engine
     */
    public static FormulaEngine of(FormulaPolicy formulaPolicy, FormulaParser parser, Evaluator evaluator,
                                   TruthTableBuilder truthTableBuilder) {
        return new FormulaEngine(formulaPolicy, parser, evaluator, truthTableBuilder);
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    /**
     * @throws LexException             on an invalid character
     * @throws ComplexityLimitException if the formula is too long
     */
    public List<Token> tokenize(String formula) {
        return FormulaLexer.tokenize(formula, formulaPolicy);
    }

    /**
     * @throws ParseException on a syntax error
     */
    public Expression parse(List<Token> tokens) {
        return parser.parse(tokens);
    }

    /**
     * Tokenizes and parses formula text.
     *
     * @throws LexException   on an invalid character
     * @throws ParseException on a syntax error
     */
    public Expression parse(String formula) {
        Expression expression = parser.parse(tokenize(formula));
        log.fine(() -> String.format("Parsed formula '%s' as %s", formula, ExpressionFormatter.format(expression)));
        return expression;
    }

    /**
     * @throws UnboundVariableException if the assignment misses a variable of the expression
     */
    public boolean evaluate(Expression expression, Assignment assignment) {
        return evaluator.evaluate(expression, assignment);
    }

    /**
     * @throws ComplexityLimitException if the expression has more variables than the policy allows
     */
    public TruthTable buildTruthTable(Expression expression) {
        return truthTableBuilder.build(expression);
    }

    public String format(Expression expression) {
        return ExpressionFormatter.format(expression);
    }

    public String format(Expression expression, Notation notation) {
        return ExpressionFormatter.format(expression, notation);
    }
}
