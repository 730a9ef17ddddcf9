package org.monkeylang.compiler.frontend.parser;

/**
 * A structured error recorded by the {@link Parser}. Errors are collected rather than thrown,
 * so a single malformed construct does not stop the parse.
 *
 * @param kind The error category.
 * @param message The human-readable description.
 * @param line The line of the offending token.
 * @param column The column of the offending token.
 */
public record ParseError(Kind kind, String message, int line, int column) {

    /**
     * The category of a parse error.
     */
    public enum Kind {
        /** A specific token was expected but another one was found. */
        UNEXPECTED_TOKEN("Unexpected Token"),
        /** The lexer could not make a token of the source text. */
        ILLEGAL_TOKEN("Illegal Token"),
        /** The input nests deeper than the parser can follow. */
        NESTING_TOO_DEEP("Nesting Too Deep");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    @Override
    public String toString() {
        return kind.displayName() + ": " + message;
    }
}
