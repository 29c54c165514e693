package io.github.cyfko.boolexpr.core.parsing;

import io.github.cyfko.boolexpr.core.exception.ExpressionLexException;
import io.github.cyfko.boolexpr.core.model.Token;
import io.github.cyfko.boolexpr.core.model.TokenizedExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass scanner turning expression text into {@link Token}s.
 * <p>
 * Recognized input:
 * </p>
 * <ul>
 *   <li>Spaces: skipped</li>
 *   <li>{@code ( ) & | ^ ! =}: operators and grouping</li>
 *   <li>{@code 1} / {@code 0}: boolean constants</li>
 *   <li>{@code true} / {@code false}: boolean constants, case-sensitive</li>
 *   <li>{@code a} to {@code z}: identifiers, only when allowed</li>
 * </ul>
 *
 * <h2>Keyword boundaries</h2>
 * <p>
 * In strict mode a keyword is accepted only when the characters right before and right after it
 * are not lowercase letters, so {@code "truea"} scans as five identifiers instead of
 * {@code true, a}. In non-strict mode any suffix starting with the keyword matches.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TokenizedExpression tokens = new Tokenizer(true).tokenize("a & b | c", true);
 * // [IDENTIFIER(a), AND, IDENTIFIER(b), OR, IDENTIFIER(c)]
 *
 * new Tokenizer(true).tokenize("a & b", false);
 * // throws ExpressionLexException: Invalid character 'a' at pos 0
 * }</pre>
 *
 * @since 1.0
 */
public final class Tokenizer {

    private static final String TRUE_KEYWORD = "true";
    private static final String FALSE_KEYWORD = "false";

    private final boolean strictKeywordBoundaries;

    /**
     * @param strictKeywordBoundaries whether keywords must not touch a lowercase letter
     */
    public Tokenizer(boolean strictKeywordBoundaries) {
        this.strictKeywordBoundaries = strictKeywordBoundaries;
    }

    /**
     * Scans the whole source.
     *
     * @param source            the expression text
     * @param allowIdentifiers  whether single letters are accepted as variables
     * @return the tokens with their offsets
     * @throws ExpressionLexException at the first character that starts no token
     */
    public TokenizedExpression tokenize(String source, boolean allowIdentifiers) {
        Objects.requireNonNull(source, "Expression cannot be null");

        List<Token> tokens = new ArrayList<>(source.length());
        int[] offsets = new int[source.length()];

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            int start = i;
            Token token;

            switch (c) {
                case ' ' -> {
                    i++;
                    continue;
                }
                case '(' -> token = Token.GROUP_OPEN;
                case ')' -> token = Token.GROUP_CLOSE;
                case '&' -> token = Token.AND;
                case '|' -> token = Token.OR;
                case '^' -> token = Token.XOR;
                case '!' -> token = Token.NOT;
                case '=' -> token = Token.EQUAL;
                case '1' -> token = Token.CONST_TRUE;
                case '0' -> token = Token.CONST_FALSE;
                default -> {
                    if (matchesKeyword(source, i, TRUE_KEYWORD)) {
                        token = Token.CONST_TRUE;
                        i += TRUE_KEYWORD.length() - 1;
                    } else if (matchesKeyword(source, i, FALSE_KEYWORD)) {
                        token = Token.CONST_FALSE;
                        i += FALSE_KEYWORD.length() - 1;
                    } else if (allowIdentifiers && isIdentifierChar(c)) {
                        token = Token.identifier(c);
                    } else {
                        throw new ExpressionLexException(source, i);
                    }
                }
            }

            offsets[tokens.size()] = start;
            tokens.add(token);
            i++;
        }

        int[] used = new int[tokens.size()];
        System.arraycopy(offsets, 0, used, 0, used.length);
        return new TokenizedExpression(source, tokens, used);
    }

    private boolean matchesKeyword(String source, int index, String keyword) {
        if (!source.startsWith(keyword, index)) {
            return false;
        }
        if (!strictKeywordBoundaries) {
            return true;
        }

        int end = index + keyword.length();
        boolean letterBefore = index > 0 && isIdentifierChar(source.charAt(index - 1));
        boolean letterAfter = end < source.length() && isIdentifierChar(source.charAt(end));
        return !letterBefore && !letterAfter;
    }

    static boolean isIdentifierChar(char c) {
        return c >= 'a' && c <= 'z';
    }
}
