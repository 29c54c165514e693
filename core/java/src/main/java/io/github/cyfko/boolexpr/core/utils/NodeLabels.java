package io.github.cyfko.boolexpr.core.utils;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;
import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;
import io.github.cyfko.boolexpr.core.model.Token;
import io.github.cyfko.boolexpr.core.model.TokenType;

/**
 * Short and extended text labels for tokens and tree nodes, used by tree and table renderers.
 *
 * <table border="1">
 * <caption>Labels</caption>
 * <thead>
 * <tr><th>Kind</th><th>Short</th><th>Extended</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>AND</td><td>&amp;</td><td>AND</td></tr>
 * <tr><td>OR</td><td>|</td><td>OR</td></tr>
 * <tr><td>XOR</td><td>^</td><td>XOR</td></tr>
 * <tr><td>NOT</td><td>!</td><td>NOT</td></tr>
 * <tr><td>EQUAL</td><td>=</td><td>EQUAL</td></tr>
 * <tr><td>Group</td><td>()</td><td>GRP</td></tr>
 * <tr><td>Const</td><td>true / false</td><td>true / false</td></tr>
 * <tr><td>Identifier</td><td>letter</td><td>letter</td></tr>
 * </tbody>
 * </table>
 *
 * @since 1.0
 */
public final class NodeLabels {

    private static final NodeVisitor<String> SHORT = new LabelVisitor(false);
    private static final NodeVisitor<String> EXTENDED = new LabelVisitor(true);

    private NodeLabels() {}

    public static String shortLabel(Node node) {
        return node.accept(SHORT);
    }

    public static String extendedLabel(Node node) {
        return node.accept(EXTENDED);
    }

    public static String shortLabel(Token token) {
        return token.type() == TokenType.IDENTIFIER
                ? String.valueOf(token.identifier())
                : shortLabel(token.type());
    }

    public static String extendedLabel(Token token) {
        return token.type() == TokenType.IDENTIFIER
                ? String.valueOf(token.identifier())
                : extendedLabel(token.type());
    }

    public static String shortLabel(TokenType type) {
        return switch (type) {
            case AND -> "&";
            case OR -> "|";
            case XOR -> "^";
            case NOT -> "!";
            case EQUAL -> "=";
            case GROUP_OPEN -> "(";
            case GROUP_CLOSE -> ")";
            case CONST_TRUE -> "1";
            case CONST_FALSE -> "0";
            case IDENTIFIER -> "ident";
        };
    }

    public static String extendedLabel(TokenType type) {
        return switch (type) {
            case CONST_TRUE -> "TRUE";
            case CONST_FALSE -> "FALSE";
            case IDENTIFIER -> "IDENT";
            default -> type.name();
        };
    }

    private static final class LabelVisitor implements NodeVisitor<String> {
        private final boolean extended;

        private LabelVisitor(boolean extended) {
            this.extended = extended;
        }

        @Override
        public String visitConst(ConstNode node) {
            return String.valueOf(node.value());
        }

        @Override
        public String visitIdentifier(IdentifierNode node) {
            return String.valueOf(node.name());
        }

        @Override
        public String visitSingleOp(SingleOpNode node) {
            return extended ? extendedLabel(node.op()) : shortLabel(node.op());
        }

        @Override
        public String visitDoubleOp(DoubleOpNode node) {
            return extended ? extendedLabel(node.op()) : shortLabel(node.op());
        }

        @Override
        public String visitGroup(GroupNode node) {
            return extended ? "GRP" : "()";
        }
    }
}
