package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.LexException;
import io.github.cyfko.proplogic.core.exception.ParseException;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Token;

import java.util.List;

/**
 * Parser turning a token sequence into an {@link Expression} tree.
 *
 * <h2>Grammar Specification (EBNF)</h2>
 * <pre>
 * biconditional := matcond ( '=' matcond )*
 * matcond       := disjunction ( '~' disjunction )*
 * disjunction   := conjunction ( '|' conjunction )*
 * conjunction   := primary ( '&amp;' primary )*
 * primary       := '!' primary | Variable | '(' biconditional ')'
 * </pre>
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(A = B)</td></tr>
 * <tr><td>NOT</td><td>!</td><td>5</td><td>Right</td><td>!A</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>4</td><td>Left</td><td>A &amp; B</td></tr>
 * <tr><td>OR</td><td>|</td><td>3</td><td>Left</td><td>A | B</td></tr>
 * <tr><td>IMPLIES</td><td>~</td><td>2</td><td>Left</td><td>A ~ B</td></tr>
 * <tr><td>IFF</td><td>=</td><td>1</td><td>Left</td><td>A = B</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Chains fold to the left: {@code A & B & C} parses as {@code (A & B) & C}. An implementation
 * either returns a complete tree or throws; it never returns a partial result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.proplogic.core.impl.RecursiveDescentFormulaParser
 */
public interface FormulaParser {

    /**
     * Parses a complete token sequence.
     *
     * @param tokens tokens produced by {@link io.github.cyfko.proplogic.core.parsing.FormulaLexer}
     * @return the expression tree
     * @throws ParseException           on an unexpected token, a missing parenthesis, premature end of input or trailing tokens
     * @throws ComplexityLimitException if the nesting depth exceeds the configured limit
     */
    Expression parse(List<Token> tokens) throws ParseException;

    /**
     * Tokenizes then parses formula text.
     *
     * @param formula formula text
     * @return the expression tree
     * @throws LexException   on an invalid character
     * @throws ParseException on a syntax error
     */
    Expression parse(String formula) throws LexException, ParseException;
}
