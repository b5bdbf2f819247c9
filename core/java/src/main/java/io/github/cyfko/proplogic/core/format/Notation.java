package io.github.cyfko.proplogic.core.format;

import io.github.cyfko.proplogic.core.model.BinaryOperator;
import io.github.cyfko.proplogic.core.model.UnaryOperator;

/**
 * Operator spelling used when writing an expression back to text.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Notation {
    /**
     * The parser's own symbols: {@code ! & | ~ =}. Output can be parsed again.
     */
    ASCII,
    /**
     * Logic symbols: {@code ¬ ∧ ∨ → ↔}. For display only.
     */
    UNICODE;

    public String symbolOf(UnaryOperator op) {
        return this == ASCII ? String.valueOf(op.symbol()) : op.unicodeSymbol();
    }

    public String symbolOf(BinaryOperator op) {
        return this == ASCII ? String.valueOf(op.symbol()) : op.unicodeSymbol();
    }
}
