package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Evaluator;
import io.github.cyfko.proplogic.core.config.FormulaPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.model.Assignment;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link EnumeratingTruthTableBuilder}: row order, completeness and limits.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("EnumeratingTruthTableBuilder Tests")
class EnumeratingTruthTableBuilderTest {

    private final RecursiveDescentFormulaParser parser = new RecursiveDescentFormulaParser();
    private EnumeratingTruthTableBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new EnumeratingTruthTableBuilder();
    }

    static Stream<Arguments> formulas() {
        return Stream.of(
                Arguments.of("A", 1),
                Arguments.of("A & B", 2),
                Arguments.of("(A ~ B) = (!B ~ !A)", 2),
                Arguments.of("A | B & C ~ D", 4),
                Arguments.of("A & B & C & D & E & F & G & H", 8)
        );
    }

    @Nested
    @DisplayName("Enumeration")
    class Enumeration {

        @ParameterizedTest(name = "{0} has 2^{1} rows")
        @MethodSource("io.github.cyfko.proplogic.core.impl.EnumeratingTruthTableBuilderTest#formulas")
        @DisplayName("Rows form the full Cartesian product without duplicates")
        void shouldEnumerateEveryAssignment(String formula, int variableCount) {
            TruthTable table = builder.build(parser.parse(formula));

            assertEquals(variableCount, table.variables().size());
            assertEquals(1 << variableCount, table.rowCount());

            Set<List<Boolean>> tuples = new HashSet<>();
            for (TruthTable.Row row : table.rows()) {
                assertEquals(variableCount, row.values().size());
                tuples.add(row.values());
            }
            assertEquals(1 << variableCount, tuples.size());
        }

        @Test
        @DisplayName("Columns are sorted and the last variable flips fastest")
        void shouldUseCanonicalOrder() {
            TruthTable table = builder.build(parser.parse("C | A & !B"));

            assertEquals(List.of(Variable.of('A'), Variable.of('B'), Variable.of('C')), table.variables());
            List<TruthTable.Row> rows = table.rows();
            assertEquals(List.of(false, false, false), rows.get(0).values());
            assertEquals(List.of(false, false, true), rows.get(1).values());
            assertEquals(List.of(false, true, false), rows.get(2).values());
            assertEquals(List.of(true, false, false), rows.get(4).values());
            assertEquals(List.of(true, true, true), rows.get(7).values());
        }

        @Test
        @DisplayName("Results match the connective semantics")
        void shouldComputeResults() {
            TruthTable implication = builder.build(parser.parse("A ~ B"));
            assertEquals(List.of(true, true, false, true),
                    implication.rows().stream().map(TruthTable.Row::result).toList());

            TruthTable iff = builder.build(parser.parse("A = B"));
            assertEquals(List.of(true, false, false, true),
                    iff.rows().stream().map(TruthTable.Row::result).toList());
        }

        @Test
        @DisplayName("Classical laws are tautologies, A & !A is a contradiction")
        void shouldDetectTautologies() {
            assertTrue(builder.build(parser.parse("A | !A")).isTautology());
            assertTrue(builder.build(parser.parse("(A ~ B) & A ~ B")).isTautology());
            assertTrue(builder.build(parser.parse("!(A | B) = !A & !B")).isTautology());
            assertTrue(builder.build(parser.parse("A & !A")).isContradiction());
        }

        @Test
        @DisplayName("Same expression gives equal tables")
        void shouldBeDeterministic() {
            Expression expression = parser.parse("(A | C) ~ B = !D");
            assertEquals(builder.build(expression), builder.build(expression));
            assertEquals(builder.build(expression).asMap(), builder.build(expression).asMap());
        }
    }

    @Nested
    @DisplayName("Evaluator delegation")
    class Delegation {

        @Mock
        private Evaluator evaluator;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
        }

        @Test
        @DisplayName("Each row is evaluated once, in canonical order")
        void shouldEvaluateEveryRowOnce() {
            Expression expression = parser.parse("A & B");
            when(evaluator.evaluate(eq(expression), any(Assignment.class))).thenReturn(false, true, false, true);

            TruthTable table = new EnumeratingTruthTableBuilder(FormulaPolicy.defaults(), evaluator).build(expression);

            ArgumentCaptor<Assignment> captor = ArgumentCaptor.forClass(Assignment.class);
            verify(evaluator, times(4)).evaluate(eq(expression), captor.capture());
            List<Assignment> assignments = captor.getAllValues();
            assertEquals(Assignment.builder().set('A', false).set('B', false).build(), assignments.get(0));
            assertEquals(Assignment.builder().set('A', false).set('B', true).build(), assignments.get(1));
            assertEquals(Assignment.builder().set('A', true).set('B', false).build(), assignments.get(2));
            assertEquals(Assignment.builder().set('A', true).set('B', true).build(), assignments.get(3));

            // the table stores what the evaluator returned
            assertEquals(List.of(1, 3), table.satisfyingRows().stream().map(TruthTable.Row::index).toList());
        }

        @Test
        @DisplayName("Limit is checked before any evaluation")
        void shouldRejectTooManyVariables() {
            FormulaPolicy policy = FormulaPolicy.builder().maxVariables(2).build();
            EnumeratingTruthTableBuilder limited = new EnumeratingTruthTableBuilder(policy, evaluator);

            ComplexityLimitException exception = assertThrows(ComplexityLimitException.class,
                    () -> limited.build(parser.parse("A & B & C")));

            assertEquals(3, exception.getActual());
            assertEquals(2, exception.getLimit());
            verifyNoInteractions(evaluator);
        }

        @Test
        @DisplayName("Constructor rejects missing collaborators")
        void shouldRejectNulls() {
            assertThrows(IllegalArgumentException.class, () -> new EnumeratingTruthTableBuilder(null, evaluator));
            assertThrows(IllegalArgumentException.class,
                    () -> new EnumeratingTruthTableBuilder(FormulaPolicy.defaults(), null));
            assertThrows(NullPointerException.class, () -> builder.build(null));
        }
    }
}
