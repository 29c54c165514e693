package io.github.cyfko.boolexpr.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Output of the tokenizer: the token sequence, the source offset of each token and the
 * original source text. Offsets are used for diagnostics only.
 *
 * @since 1.0
 */
public final class TokenizedExpression {

    private final String source;
    private final List<Token> tokens;
    private final int[] offsets;

    /**
     * @param source  the original expression
     * @param tokens  tokens in source order
     * @param offsets zero-based character offset of each token, same length as tokens
     * @throws IllegalArgumentException if the sizes differ
     */
    public TokenizedExpression(String source, List<Token> tokens, int[] offsets) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.tokens = List.copyOf(tokens);
        this.offsets = Arrays.copyOf(offsets, offsets.length);
        if (this.tokens.size() != this.offsets.length) {
            throw new IllegalArgumentException(
                    "Expected one offset per token: " + this.tokens.size() + " tokens, " + this.offsets.length + " offsets");
        }
    }

    /**
     * Builds a token sequence without real offsets; every token is located at index 0.
     * Intended for feeding hand-made token lists to the parser.
     *
     * @param source the text the tokens stand for
     * @param tokens the tokens
     * @return the tokenized expression
     */
    public static TokenizedExpression of(String source, List<Token> tokens) {
        return new TokenizedExpression(source, tokens, new int[tokens.size()]);
    }

    public String source() {
        return source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * @param index token index
     * @return the source offset of the token, or the source length past the last token
     */
    public int offsetOf(int index) {
        if (index < offsets.length) {
            return offsets[index];
        }
        return source.length();
    }

    @Override
    public String toString() {
        return "TokenizedExpression[" + tokens + "]";
    }
}
