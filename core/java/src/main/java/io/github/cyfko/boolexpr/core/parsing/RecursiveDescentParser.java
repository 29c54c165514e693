package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.config.ExpressionPolicy;
import io.github.cyfko.boolexpr.core.exception.ExpressionParseException;
import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;
import io.github.cyfko.boolexpr.core.model.Token;
import io.github.cyfko.boolexpr.core.model.TokenType;
import io.github.cyfko.boolexpr.core.model.TokenizedExpression;

import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser building an AST from a {@link TokenizedExpression}.
 * <p>
 * Precedence from lowest to highest:
 * </p>
 * <pre>
 * equality   := xor_expr ( '=' xor_expr )*
 * xor_expr   := or_expr  ( '^' or_expr  )*
 * or_expr    := and_expr ( '|' and_expr )*
 * and_expr   := not_expr ( '&amp;' not_expr )*
 * not_expr   := '!' not_expr | factor
 * factor     := IDENTIFIER | '1' | '0' | '(' equality ')'
 * </pre>
 * <ul>
 *   <li>Binary operators are left-associative: {@code a&b&c} gives {@code (a&b)&c}</li>
 *   <li>Negation nests: {@code !!a} gives two {@link SingleOpNode}s</li>
 *   <li>The whole token sequence must be consumed</li>
 *   <li>Each {@code (} and {@code !} enclosing a token adds one level of nesting; going past the
 *       limit is a parse error at that token</li>
 * </ul>
 *
 * <p>
 * An instance holds a cursor and parses a single token sequence; it is not reusable and not
 * thread-safe. Use {@link #parse(TokenizedExpression)} for a one-shot call.
 * </p>
 *
 * @since 1.0
 */
public final class RecursiveDescentParser {

    private final TokenizedExpression input;
    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int position;
    private int depth;

    private RecursiveDescentParser(TokenizedExpression input, int maxNestingDepth) {
        this.input = input;
        this.tokens = input.tokens();
        this.maxNestingDepth = maxNestingDepth;
        this.position = 0;
    }

    /**
     * Parses a complete token sequence.
     *
     * @param input tokens produced by {@link Tokenizer}
     * @return the root of the AST
     * @throws ExpressionParseException if the tokens do not form exactly one expression
     */
    public static Node parse(TokenizedExpression input) {
        return parse(input, ExpressionPolicy.defaults().maxNestingDepth());
    }

    /**
     * Parses a complete token sequence with a bound on nesting.
     *
     * @param input           tokens produced by {@link Tokenizer}
     * @param maxNestingDepth maximum combined depth of open groups and negations
     * @return the root of the AST
     * @throws ExpressionParseException if the tokens do not form exactly one expression,
     *                                  or nest deeper than {@code maxNestingDepth}
     */
    public static Node parse(TokenizedExpression input, int maxNestingDepth) {
        Objects.requireNonNull(input, "Token sequence cannot be null");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }

        RecursiveDescentParser parser = new RecursiveDescentParser(input, maxNestingDepth);
        Node root = parser.parseEquality();
        if (parser.peek() != null) {
            throw parser.errorAtCursor();
        }
        return root;
    }

    private Node parseEquality() {
        Node left = parseXor();
        while (peekType() == TokenType.EQUAL) {
            consume();
            left = new DoubleOpNode(TokenType.EQUAL, left, parseXor());
        }
        return left;
    }

    private Node parseXor() {
        Node left = parseOr();
        while (peekType() == TokenType.XOR) {
            consume();
            left = new DoubleOpNode(TokenType.XOR, left, parseOr());
        }
        return left;
    }

    private Node parseOr() {
        Node left = parseAnd();
        while (peekType() == TokenType.OR) {
            consume();
            left = new DoubleOpNode(TokenType.OR, left, parseAnd());
        }
        return left;
    }

    private Node parseAnd() {
        Node left = parseNot();
        while (peekType() == TokenType.AND) {
            consume();
            left = new DoubleOpNode(TokenType.AND, left, parseNot());
        }
        return left;
    }

    private Node parseNot() {
        if (peekType() == TokenType.NOT) {
            enter();
            Node operand = parseNot();
            depth--;
            return SingleOpNode.not(operand);
        }
        return parseFactor();
    }

    private Node parseFactor() {
        Token token = peek();
        if (token == null) {
            throw errorAtCursor();
        }

        switch (token.type()) {
            case IDENTIFIER -> {
                consume();
                return new IdentifierNode(token.identifier());
            }
            case CONST_TRUE -> {
                consume();
                return ConstNode.TRUE;
            }
            case CONST_FALSE -> {
                consume();
                return ConstNode.FALSE;
            }
            case GROUP_OPEN -> {
                enter();
                Node inner = parseEquality();
                if (peekType() != TokenType.GROUP_CLOSE) {
                    throw errorAtCursor();
                }
                consume();
                depth--;
                return new GroupNode(inner);
            }
            default -> throw errorAtCursor();
        }
    }

    private Token peek() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private TokenType peekType() {
        Token token = peek();
        return token == null ? null : token.type();
    }

    private void consume() {
        position++;
    }

    // consumes a '(' or '!' and opens one nesting level
    private void enter() {
        if (depth == maxNestingDepth) {
            throw errorAtCursor();
        }
        depth++;
        consume();
    }

    private ExpressionParseException errorAtCursor() {
        return new ExpressionParseException(input.source(), input.offsetOf(position));
    }
}
