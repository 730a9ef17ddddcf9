package org.monkeylang.compiler.frontend.parser;

/**
 * Binding power of operators, weakest first. Only used as a threshold while parsing;
 * precedence is never stored in the AST.
 */
public enum Precedence {
    LOWEST,
    /** {@code ==} and {@code !=} */
    EQUALS,
    /** {@code <}, {@code <=}, {@code >} and {@code >=} */
    LESS_GREATER,
    /** {@code +} and {@code -} */
    SUM,
    /** {@code *} and {@code /} */
    PRODUCT,
    /** {@code -x} and {@code !x} */
    PREFIX,
    /** {@code f(x)} */
    CALL;

    /**
     * Checks whether this precedence binds strictly weaker than {@code other}.
     */
    public boolean isLowerThan(Precedence other) {
        return compareTo(other) < 0;
    }
}
