package io.github.cyfko.boolexpr.core.model;

import java.util.Objects;

/**
 * A lexical token. Only {@link TokenType#IDENTIFIER} tokens carry a value, the variable letter.
 * <p>
 * Tokens hold no source position; offsets are kept next to the token list in
 * {@link TokenizedExpression}.
 * </p>
 *
 * @param type       the lexical category
 * @param identifier the variable letter for identifiers, {@code '\0'} otherwise
 * @since 1.0
 */
public record Token(TokenType type, char identifier) {

    public static final Token AND = new Token(TokenType.AND, '\0');
    public static final Token OR = new Token(TokenType.OR, '\0');
    public static final Token XOR = new Token(TokenType.XOR, '\0');
    public static final Token NOT = new Token(TokenType.NOT, '\0');
    public static final Token EQUAL = new Token(TokenType.EQUAL, '\0');
    public static final Token GROUP_OPEN = new Token(TokenType.GROUP_OPEN, '\0');
    public static final Token GROUP_CLOSE = new Token(TokenType.GROUP_CLOSE, '\0');
    public static final Token CONST_TRUE = new Token(TokenType.CONST_TRUE, '\0');
    public static final Token CONST_FALSE = new Token(TokenType.CONST_FALSE, '\0');

    public Token {
        Objects.requireNonNull(type, "Token type cannot be null");
        if (type == TokenType.IDENTIFIER && (identifier < 'a' || identifier > 'z')) {
            throw new IllegalArgumentException("Identifier must be a lowercase letter a-z, got: '" + identifier + "'");
        }
        if (type != TokenType.IDENTIFIER && identifier != '\0') {
            throw new IllegalArgumentException("Only identifier tokens carry a value: " + type);
        }
    }

    /**
     * Creates an identifier token.
     *
     * @param letter variable letter, {@code a} to {@code z}
     * @return the token
     */
    public static Token identifier(char letter) {
        return new Token(TokenType.IDENTIFIER, letter);
    }

    @Override
    public String toString() {
        return type == TokenType.IDENTIFIER ? "IDENTIFIER(" + identifier + ")" : type.name();
    }
}
