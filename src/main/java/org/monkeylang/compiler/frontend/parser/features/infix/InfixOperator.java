package org.monkeylang.compiler.frontend.parser.features.infix;

import org.monkeylang.compiler.frontend.lexer.TokenType;

/**
 * Binary operators written between their operands.
 */
public enum InfixOperator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    InfixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Maps an operator token to its infix operator.
     * @throws IllegalStateException if the token type is not an infix operator.
     */
    public static InfixOperator of(TokenType type) {
        return switch (type) {
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case ASTERISK -> MULTIPLY;
            case SLASH -> DIVIDE;
            case EQUAL -> EQUAL;
            case NOT_EQUAL -> NOT_EQUAL;
            case LESS_THAN -> LESS_THAN;
            case LESS_EQUAL -> LESS_EQUAL;
            case GREATER_THAN -> GREATER_THAN;
            case GREATER_EQUAL -> GREATER_EQUAL;
            default -> throw new IllegalStateException("Not an infix operator: " + type);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
