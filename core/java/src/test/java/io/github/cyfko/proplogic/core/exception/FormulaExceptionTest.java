package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.model.Token;
import io.github.cyfko.proplogic.core.model.TokenType;
import io.github.cyfko.proplogic.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaExceptionTest {

    @Test
    @DisplayName("Should describe an invalid character")
    void shouldDescribeInvalidCharacter() {
        // When
        LexException exception = new LexException('#', 7);

        // Then
        assertEquals("Invalid character '#' at position 7", exception.getMessage());
        assertEquals("#", exception.getCharacter());
        assertEquals(7, exception.getPosition());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should describe expected versus found token")
    void shouldDescribeUnexpectedToken() {
        // Given
        Token found = Token.symbol(TokenType.RIGHT_PAREN, 3);

        // When
        ParseException exception = new ParseException("')'", found);

        // Then
        assertEquals("Expected ')' but found ')' at position 3", exception.getMessage());
        assertSame(found, exception.getFound());
        assertEquals(3, exception.getPosition());
        assertFalse(exception.isEndOfInput());
    }

    @Test
    @DisplayName("Should describe premature end of input")
    void shouldDescribeEndOfInput() {
        // When
        ParseException exception = new ParseException("variable", null);

        // Then
        assertEquals("Expected variable but reached end of input", exception.getMessage());
        assertTrue(exception.isEndOfInput());
        assertEquals(-1, exception.getPosition());
    }

    @Test
    @DisplayName("Should name the unbound variable")
    void shouldNameUnboundVariable() {
        // When
        UnboundVariableException exception = new UnboundVariableException(Variable.of('K'));

        // Then
        assertEquals("Variable K has no value in the assignment", exception.getMessage());
        assertEquals(Variable.of('K'), exception.getVariable());
    }

    @Test
    @DisplayName("Should be unchecked formula exceptions")
    void shouldShareUncheckedBase() {
        // Then
        assertInstanceOf(FormulaException.class, new LexException('x', 0));
        assertInstanceOf(FormulaException.class, new ParseException("x", null));
        assertInstanceOf(FormulaException.class, new UnboundVariableException(Variable.of('A')));
        assertInstanceOf(RuntimeException.class, new ComplexityLimitException("too big", 2, 1));
    }
}
