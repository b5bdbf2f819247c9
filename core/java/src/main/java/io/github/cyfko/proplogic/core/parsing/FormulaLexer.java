package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.config.FormulaPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.LexException;
import io.github.cyfko.proplogic.core.model.Token;
import io.github.cyfko.proplogic.core.model.TokenType;
import io.github.cyfko.proplogic.core.model.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass tokenizer turning formula text into {@link Token}s.
 * <p>
 * Recognized input:
 * </p>
 * <ul>
 *   <li>Whitespace, including every Unicode space separator: skipped</li>
 *   <li>One ASCII letter, either case: a {@code VARIABLE} token with the uppercase {@link Variable}</li>
 *   <li>{@code ! & | ~ = ( )}: one token each</li>
 * </ul>
 * <p>
 * Anything else fails with a {@link LexException} naming the character and its position.
 * The tokenizer knows nothing about the grammar: {@code ")A("} lexes fine and is rejected by the parser.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = FormulaLexer.tokenize("a & !b");
 * // [VARIABLE A @0, AND @2, NOT @4, VARIABLE B @5]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaLexer {

    private FormulaLexer() {}

    /**
     * Tokenizes under {@link FormulaPolicy#defaults()}.
     *
     * @param formula the formula text
     * @return the tokens in source order
     * @throws LexException on an unrecognized character
     */
    public static List<Token> tokenize(String formula) {
        return tokenize(formula, FormulaPolicy.defaults());
    }

    /**
     * Tokenizes the given formula.
     *
     * @param formula the formula text
     * @param policy  limits to enforce
     * @return the tokens in source order, unmodifiable
     * @throws LexException             on an unrecognized character
     * @throws ComplexityLimitException if the text is longer than {@link FormulaPolicy#maxFormulaLength()}
     */
    public static List<Token> tokenize(String formula, FormulaPolicy policy) {
        Objects.requireNonNull(formula, "Formula cannot be null");
        Objects.requireNonNull(policy, "Formula policy is required");

        // DoS protection
        if (formula.length() > policy.maxFormulaLength()) {
            throw new ComplexityLimitException(String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    formula.length(), policy.maxFormulaLength(), policy.policyName()),
                    formula.length(), policy.maxFormulaLength());
        }

        List<Token> tokens = new ArrayList<>(formula.length());
        int i = 0;
        while (i < formula.length()) {
            int c = formula.codePointAt(i);

            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                i += Character.charCount(c);
                continue;
            }

            if (c < Character.MIN_SUPPLEMENTARY_CODE_POINT && Variable.isLetter((char) c)) {
                tokens.add(Token.variable(Variable.of((char) c), i));
            } else {
                TokenType type = c < Character.MIN_SUPPLEMENTARY_CODE_POINT ? TokenType.forSymbol((char) c) : null;
                if (type == null) {
                    throw new LexException(c, i);
                }
                tokens.add(Token.symbol(type, i));
            }
            i += Character.charCount(c);
        }

        return Collections.unmodifiableList(tokens);
    }
}
