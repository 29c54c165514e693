package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.exception.ExpressionSyntaxException;

/**
 * Parser transforming boolean algebra text into an immutable {@link Node} tree.
 *
 * <h2>Operators</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(a &amp; b)</td></tr>
 * <tr><td>NOT</td><td>!</td><td>5</td><td>Right</td><td>!a</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>4</td><td>Left</td><td>a &amp; b</td></tr>
 * <tr><td>OR</td><td>|</td><td>3</td><td>Left</td><td>a | b</td></tr>
 * <tr><td>XOR</td><td>^</td><td>2</td><td>Left</td><td>a ^ b</td></tr>
 * <tr><td>EQUAL</td><td>=</td><td>1</td><td>Left</td><td>a = b</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Constants are {@code 1}, {@code true}, {@code 0} and {@code false}. Variables are single
 * lowercase letters; they are rejected when {@code allowIdentifiers} is false.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 *
 * Node constant = parser.parse("1 & !0", false);
 * Node withVariables = parser.parse("(a | b) = !c", true);
 *
 * parser.parse("a &", true);     // ExpressionParseException: missing operand
 * parser.parse("(a & b", true);  // ExpressionParseException: unterminated group
 * parser.parse("a & b", false);  // ExpressionLexException: identifiers not allowed
 * }</pre>
 *
 * @see Node
 * @see ExpressionSyntaxException
 * @since 1.0
 */
public interface ExpressionParser {

    /**
     * Parses an expression.
     *
     * @param expression       the expression text, must not be null
     * @param allowIdentifiers whether variables {@code a} to {@code z} may appear
     * @return the root of the parsed tree
     * @throws ExpressionSyntaxException if the text is rejected by the tokenizer, the parser or the policy
     * @throws NullPointerException      if expression is null
     */
    Node parse(String expression, boolean allowIdentifiers) throws ExpressionSyntaxException;
}
