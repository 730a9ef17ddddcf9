package org.monkeylang.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token ({@link Long} for integers, {@link Boolean}
 *              for booleans), or null.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Creates a token without a decoded value.
     */
    public Token(TokenType type, String text, int line, int column) {
        this(type, text, null, line, column);
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * Describes the token for diagnostics, e.g. {@code Int(5)}, {@code Ident(x)} or {@code Assign}.
     */
    public String describe() {
        return switch (type) {
            case IDENT -> type.displayName() + "(" + text + ")";
            case INT, BOOL -> type.displayName() + "(" + value + ")";
            default -> type.displayName();
        };
    }
}
