package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.UnboundVariableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assignment Tests")
class AssignmentTest {

    private static final Variable A = Variable.of('A');
    private static final Variable B = Variable.of('B');
    private static final Variable C = Variable.of('C');

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Builder binds letters and the last value wins")
        void builderShouldOverwrite() {
            Assignment assignment = Assignment.builder()
                    .set('a', true)
                    .set('B', false)
                    .set('A', false)
                    .build();

            assertFalse(assignment.valueOf(A));
            assertFalse(assignment.valueOf(B));
            assertEquals(2, assignment.size());
        }

        @Test
        @DisplayName("of(Map) copies every entry")
        void shouldCopyMap() {
            Map<Variable, Boolean> values = new HashMap<>();
            values.put(A, true);
            values.put(C, false);

            Assignment assignment = Assignment.of(values);
            values.put(B, true);

            assertTrue(assignment.valueOf(A));
            assertFalse(assignment.valueOf(C));
            assertFalse(assignment.binds(B));
        }

        @Test
        @DisplayName("of(Map) rejects null values")
        void shouldRejectNullValue() {
            Map<Variable, Boolean> values = new HashMap<>();
            values.put(A, null);
            assertThrows(NullPointerException.class, () -> Assignment.of(values));
        }

        @Test
        @DisplayName("Builder binds by variable and by letter, last value wins")
        void builderShouldAcceptVariablesAndLetters() {
            Assignment assignment = Assignment.builder()
                    .set(A, true)
                    .set('b', true)
                    .set(B, false)
                    .build();

            assertTrue(assignment.valueOf(A));
            assertFalse(assignment.valueOf(B));
            assertEquals(2, assignment.size());
            assertThrows(NullPointerException.class, () -> Assignment.builder().set((Variable) null, true));
        }

        @Test
        @DisplayName("zip rejects null values")
        void zipShouldRejectNullValue() {
            List<Boolean> values = new ArrayList<>();
            values.add(null);
            assertThrows(NullPointerException.class, () -> Assignment.zip(List.of(A), values));
        }

        @Test
        @DisplayName("zip pairs variables and values by position")
        void shouldZip() {
            Assignment assignment = Assignment.zip(List.of(A, B), List.of(false, true));
            assertFalse(assignment.valueOf(A));
            assertTrue(assignment.valueOf(B));
        }

        @Test
        @DisplayName("zip rejects size mismatch and duplicates")
        void zipShouldValidate() {
            assertThrows(IllegalArgumentException.class, () -> Assignment.zip(List.of(A, B), List.of(true)));
            assertThrows(IllegalArgumentException.class, () -> Assignment.zip(List.of(A, A), List.of(true, false)));
        }

        @Test
        @DisplayName("Empty assignment binds nothing")
        void emptyShouldBindNothing() {
            assertEquals(0, Assignment.empty().size());
            assertTrue(Assignment.empty().variables().isEmpty());
            assertEquals(Assignment.empty(), Assignment.builder().build());
        }
    }

    @Test
    @DisplayName("Lookup of an unbound variable fails with UnboundVariableException")
    void shouldFailOnUnboundVariable() {
        Assignment assignment = Assignment.builder().set('A', true).build();

        UnboundVariableException exception = assertThrows(UnboundVariableException.class,
                () -> assignment.valueOf(B));
        assertEquals(B, exception.getVariable());
    }

    @Test
    @DisplayName("Views are sorted and equality is by content")
    void shouldExposeSortedViews() {
        Assignment first = Assignment.builder().set('C', true).set('A', false).build();
        Assignment second = Assignment.builder().set('A', false).set('C', true).build();

        assertEquals(List.of(A, C), List.copyOf(first.variables()));
        assertEquals(Map.of(A, false, C, true), first.asMap());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals("{A=0, C=1}", first.toString());
        assertThrows(UnsupportedOperationException.class, () -> first.asMap().put(B, true));
    }
}
