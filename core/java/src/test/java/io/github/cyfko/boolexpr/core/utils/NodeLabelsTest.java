package io.github.cyfko.boolexpr.core.utils;

import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;
import io.github.cyfko.boolexpr.core.model.Token;
import io.github.cyfko.boolexpr.core.model.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NodeLabels Tests")
class NodeLabelsTest {

    private static final IdentifierNode A = new IdentifierNode('a');

    @ParameterizedTest(name = "{0} -> {1} / {2}")
    @CsvSource(delimiter = ';', value = {
            "AND;&;AND",
            "OR;|;OR",
            "XOR;^;XOR",
            "NOT;!;NOT",
            "EQUAL;=;EQUAL",
            "GROUP_OPEN;(;GROUP_OPEN",
            "GROUP_CLOSE;);GROUP_CLOSE",
            "CONST_TRUE;1;TRUE",
            "CONST_FALSE;0;FALSE"
    })
    @DisplayName("Should label every token type")
    void shouldLabelTokenTypes(TokenType type, String shortLabel, String extendedLabel) {
        assertEquals(shortLabel, NodeLabels.shortLabel(type));
        assertEquals(extendedLabel, NodeLabels.extendedLabel(type));
    }

    @Test
    @DisplayName("Should label identifier tokens with their letter")
    void shouldLabelIdentifierTokens() {
        assertEquals("q", NodeLabels.shortLabel(Token.identifier('q')));
        assertEquals("q", NodeLabels.extendedLabel(Token.identifier('q')));
        assertEquals("^", NodeLabels.shortLabel(Token.XOR));
    }

    @Test
    @DisplayName("Should label every node kind")
    void shouldLabelNodes() {
        assertAll(
                () -> assertEquals("true", NodeLabels.shortLabel(ConstNode.TRUE)),
                () -> assertEquals("false", NodeLabels.extendedLabel(ConstNode.FALSE)),
                () -> assertEquals("a", NodeLabels.shortLabel(A)),
                () -> assertEquals("!", NodeLabels.shortLabel(SingleOpNode.not(A))),
                () -> assertEquals("NOT", NodeLabels.extendedLabel(SingleOpNode.not(A))),
                () -> assertEquals("=", NodeLabels.shortLabel(new DoubleOpNode(TokenType.EQUAL, A, A))),
                () -> assertEquals("EQUAL", NodeLabels.extendedLabel(new DoubleOpNode(TokenType.EQUAL, A, A))),
                () -> assertEquals("()", NodeLabels.shortLabel(new GroupNode(A))),
                () -> assertEquals("GRP", NodeLabels.extendedLabel(new GroupNode(A)))
        );
    }
}
