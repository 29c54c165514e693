package io.github.cyfko.boolexpr.core.eval;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.impl.BasicExpressionParser;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.PassResult;
import io.github.cyfko.boolexpr.core.model.RowFilter;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;
import io.github.cyfko.boolexpr.core.model.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Evaluator Tests")
class EvaluatorTest {

    private static final IdentifierNode A = new IdentifierNode('a');
    private static final IdentifierNode B = new IdentifierNode('b');

    private final BasicExpressionParser parser = new BasicExpressionParser();

    private Evaluator evaluatorFor(String expression) {
        return new Evaluator(parser.parse(expression, true));
    }

    private static List<PassResult> rows(Iterable<PassResult> iterable) {
        List<PassResult> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("AND should be true only when both operands are true")
        void andTruthTable() {
            Evaluator evaluator = new Evaluator(new DoubleOpNode(TokenType.AND, A, B));

            assertFalse(evaluator.evaluate(0));
            assertFalse(evaluator.evaluate(1));
            assertFalse(evaluator.evaluate(2));
            assertTrue(evaluator.evaluate(3));
        }

        @Test
        @DisplayName("OR should be false only when both operands are false")
        void orTruthTable() {
            Evaluator evaluator = new Evaluator(new DoubleOpNode(TokenType.OR, A, B));

            assertFalse(evaluator.evaluate(0));
            assertTrue(evaluator.evaluate(1));
            assertTrue(evaluator.evaluate(2));
            assertTrue(evaluator.evaluate(3));
        }

        @Test
        @DisplayName("XOR should be true when operands differ")
        void xorTruthTable() {
            Evaluator evaluator = new Evaluator(new DoubleOpNode(TokenType.XOR, A, B));

            assertFalse(evaluator.evaluate(0));
            assertTrue(evaluator.evaluate(1));
            assertTrue(evaluator.evaluate(2));
            assertFalse(evaluator.evaluate(3));
        }

        @Test
        @DisplayName("EQUAL should be true when operands match")
        void equalTruthTable() {
            Evaluator evaluator = new Evaluator(new DoubleOpNode(TokenType.EQUAL, A, B));

            assertTrue(evaluator.evaluate(0));
            assertFalse(evaluator.evaluate(1));
            assertFalse(evaluator.evaluate(2));
            assertTrue(evaluator.evaluate(3));
        }

        @Test
        @DisplayName("NOT should invert its operand")
        void notTruthTable() {
            Evaluator evaluator = new Evaluator(SingleOpNode.not(A));

            assertTrue(evaluator.evaluate(0));
            assertFalse(evaluator.evaluate(1));
        }

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource({
                "1, true",
                "0, false",
                "true & false, false",
                "!0, true",
                "!!1, true",
                "!!!1, false",
                "1 ^ 1, false",
                "0 = 0, true",
                "(1 | 0) & !(0 ^ 0), true",
                "1 = 0 | 1, true",
                "0 ^ 1 = 0, false"
        })
        @DisplayName("Should evaluate constant expressions")
        void shouldEvaluateConstants(String expression, boolean expected) {
            assertEquals(expected, new Evaluator(parser.parse(expression, false)).evaluate(0));
        }

        @Test
        @DisplayName("Should match rows by identifier value for every binary operator")
        void shouldMatchRowsByIdentifierValue() {
            Map<String, List<Boolean>> expected = Map.of(
                    "a&b", List.of(false, false, false, true),
                    "a|b", List.of(false, true, true, true),
                    "a^b", List.of(false, true, true, false),
                    "a=b", List.of(true, false, false, true)
            );

            expected.forEach((expression, results) -> {
                for (PassResult row : evaluatorFor(expression).evaluateAll()) {
                    // results indexed as (a,b): FF, FT, TF, TT
                    int column = (row.stateOf('a') ? 2 : 0) + (row.stateOf('b') ? 1 : 0);
                    assertEquals(results.get(column), row.result(), expression + " at " + row.identifierStates());
                }
            });
        }
    }

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("Group should evaluate like its content for every assignment")
        void groupShouldBeTransparent() {
            Evaluator grouped = evaluatorFor("(a&b)");
            Evaluator plain = evaluatorFor("a&b");

            for (long pass = 0; pass < 4; pass++) {
                assertEquals(plain.evaluate(pass), grouped.evaluate(pass));
            }
        }

        @Test
        @DisplayName("Parentheses should override precedence")
        void groupShouldOverridePrecedence() {
            Evaluator grouped = evaluatorFor("(a | b) & c");
            Evaluator plain = evaluatorFor("a | b & c");

            // a=1, b=0, c=0
            assertFalse(grouped.evaluate(0b001));
            assertTrue(plain.evaluate(0b001));
        }
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Should list distinct identifiers in ascending order")
        void shouldListIdentifiers() {
            assertEquals(List.of('a', 'b', 'c'), evaluatorFor("c & a | b & c & !a").getIdentifiers());
        }

        @Test
        @DisplayName("Should assign the same bits whatever the source order")
        void shouldAssignCanonicalBits() {
            Evaluator first = evaluatorFor("c & !a | b");
            Evaluator second = evaluatorFor("b | !a & c");

            for (char identifier : new char[]{'a', 'b', 'c'}) {
                assertEquals(first.getIndex().bitOf(identifier), second.getIndex().bitOf(identifier));
            }
            for (long pass = 0; pass < 8; pass++) {
                assertEquals(first.evaluate(pass), second.evaluate(pass));
            }
        }

        @Test
        @DisplayName("Should read identifier state from its bit")
        void shouldReadIdentifierState() {
            Evaluator evaluator = evaluatorFor("a & c");

            assertTrue(evaluator.identifierState('c', 0b10));
            assertFalse(evaluator.identifierState('a', 0b10));
            assertThrows(IllegalArgumentException.class, () -> evaluator.identifierState('b', 0));
        }

        @Test
        @DisplayName("Should ignore bits above the identifier count")
        void shouldIgnoreHighBits() {
            Evaluator evaluator = evaluatorFor("a");

            assertTrue(evaluator.evaluate(0b101));
            assertFalse(evaluator.evaluate(0b110));
        }
    }

    @Nested
    @DisplayName("Enumeration")
    class Enumeration {

        @Test
        @DisplayName("Should produce exactly one row without identifiers")
        void shouldProduceOneRowForConstants() {
            Evaluator evaluator = evaluatorFor("1 ^ 0");

            List<PassResult> rows = rows(evaluator.evaluateAll());

            assertEquals(1, rows.size());
            assertEquals(1L, evaluator.rowCount());
            assertTrue(rows.get(0).result());
            assertTrue(rows.get(0).identifierStates().isEmpty());
        }

        @Test
        @DisplayName("Should produce two rows for one identifier")
        void shouldProduceTwoRowsForOneIdentifier() {
            List<PassResult> rows = rows(evaluatorFor("!a").evaluateAll());

            assertEquals(2, rows.size());
            assertTrue(rows.get(0).result());
            assertFalse(rows.get(1).result());
        }

        @Test
        @DisplayName("Should produce 2^n rows in ascending pass order")
        void shouldEnumerateAscending() {
            List<PassResult> rows = rows(evaluatorFor("a ^ b ^ c ^ d").evaluateAll());

            assertEquals(16, rows.size());
            for (int i = 0; i < rows.size(); i++) {
                assertEquals(i, rows.get(i).pass());
                assertEquals(Integer.bitCount(i) % 2 == 1, rows.get(i).result());
            }
        }

        @Test
        @DisplayName("Should decode each pass into identifier states in bit order")
        void shouldDecodeStates() {
            List<PassResult> rows = rows(evaluatorFor("b | a").evaluateAll());

            assertEquals(List.of('a', 'b'), new ArrayList<>(rows.get(1).identifierStates().keySet()));
            assertEquals(Map.of('a', true, 'b', false), rows.get(1).identifierStates());
            assertEquals(Map.of('a', false, 'b', true), rows.get(2).identifierStates());
        }

        @Test
        @DisplayName("Should restart the enumeration on every iteration")
        void shouldBeRestartable() {
            Iterable<PassResult> table = evaluatorFor("a & b").evaluateAll();

            List<PassResult> first = rows(table);
            List<PassResult> second = rows(table);

            assertEquals(4, first.size());
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Should keep only rows matching the filter")
        void shouldFilterRows() {
            Evaluator evaluator = evaluatorFor("a = b");

            List<Long> trueRows = evaluator.stream(RowFilter.TRUE_ONLY).map(PassResult::pass).collect(Collectors.toList());
            List<Long> falseRows = evaluator.stream(RowFilter.FALSE_ONLY).map(PassResult::pass).collect(Collectors.toList());

            assertEquals(List.of(0L, 3L), trueRows);
            assertEquals(List.of(1L, 2L), falseRows);
        }

        @Test
        @DisplayName("Exhausted iterator should throw NoSuchElementException")
        void exhaustedIteratorShouldThrow() {
            Iterator<PassResult> iterator = evaluatorFor("0").evaluateAll().iterator();

            iterator.next();

            assertFalse(iterator.hasNext());
            assertThrows(NoSuchElementException.class, iterator::next);
        }

        @Test
        @DisplayName("Should handle the 26 identifier boundary without enumerating")
        void shouldHandleAllIdentifiers() {
            Evaluator evaluator = evaluatorFor(
                    "a&b&c&d&e&f&g&h&i&j&k&l&m&n&o&p&q&r&s&t&u&v&w&x&y&z");
            long all = (1L << 26) - 1;

            assertEquals(26, evaluator.getIdentifiers().size());
            assertEquals(1L << 26, evaluator.rowCount());
            assertTrue(evaluator.evaluate(all));
            assertFalse(evaluator.evaluate(all & ~(1L << 25)));
            assertEquals(25, evaluator.getIndex().bitOf('z'));

            Iterator<PassResult> iterator = evaluator.evaluateAll(RowFilter.ALL).iterator();
            PassResult first = iterator.next();
            assertEquals(0L, first.pass());
            assertFalse(first.result());
        }
    }

    @Nested
    @DisplayName("Deep trees")
    class DeepTrees {

        @Test
        @DisplayName("Should evaluate a deep negation chain")
        void shouldEvaluateDeepNegationChain() {
            Node tree = A;
            for (int i = 0; i < 100_001; i++) {
                tree = SingleOpNode.not(tree);
            }
            Evaluator evaluator = new Evaluator(tree);

            assertTrue(evaluator.evaluate(0b0));
            assertFalse(evaluator.evaluate(0b1));
        }

        @Test
        @DisplayName("Should evaluate a deep left-leaning chain in operand order")
        void shouldEvaluateDeepChain() {
            Node tree = A;
            for (int i = 0; i < 100_000; i++) {
                tree = new DoubleOpNode(i % 2 == 0 ? TokenType.OR : TokenType.AND, tree, B);
            }
            Evaluator evaluator = new Evaluator(tree);

            // ends with "... & b": false whenever b is false
            assertFalse(evaluator.evaluate(0b01));
            assertTrue(evaluator.evaluate(0b10));
            assertTrue(evaluator.evaluate(0b11));
        }
    }

    @Nested
    @DisplayName("Contract violations")
    class ContractViolations {

        @Test
        @DisplayName("Should fail on a unary node holding a binary operator")
        void shouldFailOnInvalidUnaryOperator() {
            Node invalid = new SingleOpNode(TokenType.AND, A);

            assertThrows(IllegalStateException.class, () -> new Evaluator(invalid).evaluate(0));
        }

        @Test
        @DisplayName("Should fail on a binary node holding NOT")
        void shouldFailOnInvalidBinaryOperator() {
            Node invalid = new DoubleOpNode(TokenType.NOT, A, B);

            assertThrows(IllegalStateException.class, () -> new Evaluator(invalid).evaluate(0));
        }

        @Test
        @DisplayName("Should reject a null tree")
        void shouldRejectNullTree() {
            assertThrows(NullPointerException.class, () -> new Evaluator(null));
        }
    }

    @Test
    @DisplayName("Should give identical results when re-parsing and re-evaluating")
    void shouldBeDeterministic() {
        String expression = "!(a ^ b) = (c | d) & !e";

        List<PassResult> first = rows(evaluatorFor(expression).evaluateAll());
        List<PassResult> second = rows(evaluatorFor(expression).evaluateAll());

        assertEquals(first, second);
    }
}
