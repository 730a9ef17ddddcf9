package org.monkeylang.compiler.frontend.parser.features.prefix;

import org.monkeylang.compiler.frontend.lexer.TokenType;

/**
 * Unary operators written before their operand.
 */
public enum PrefixOperator {
    NOT("!"),
    NEGATE("-");

    private final String symbol;

    PrefixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Maps an operator token to its prefix operator.
     * @throws IllegalStateException if the token type is not a prefix operator.
     */
    public static PrefixOperator of(TokenType type) {
        return switch (type) {
            case BANG -> NOT;
            case MINUS -> NEGATE;
            default -> throw new IllegalStateException("Not a prefix operator: " + type);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
