package io.github.cyfko.boolexpr.core.model;

/**
 * Lexical categories of the boolean expression grammar.
 *
 * <table border="1">
 * <caption>Token spellings</caption>
 * <thead>
 * <tr><th>Type</th><th>Spelling</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>AND</td><td>&amp;</td></tr>
 * <tr><td>OR</td><td>|</td></tr>
 * <tr><td>XOR</td><td>^</td></tr>
 * <tr><td>NOT</td><td>!</td></tr>
 * <tr><td>EQUAL</td><td>=</td></tr>
 * <tr><td>GROUP_OPEN / GROUP_CLOSE</td><td>( )</td></tr>
 * <tr><td>CONST_TRUE</td><td>1, true</td></tr>
 * <tr><td>CONST_FALSE</td><td>0, false</td></tr>
 * <tr><td>IDENTIFIER</td><td>a to z</td></tr>
 * </tbody>
 * </table>
 *
 * @since 1.0
 */
public enum TokenType {
    AND,
    OR,
    XOR,
    NOT,
    EQUAL,
    GROUP_OPEN,
    GROUP_CLOSE,
    CONST_TRUE,
    CONST_FALSE,
    IDENTIFIER;

    /**
     * @return true for the four binary operators
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR || this == XOR || this == EQUAL;
    }
}
