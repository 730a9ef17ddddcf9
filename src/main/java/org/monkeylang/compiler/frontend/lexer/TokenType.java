package org.monkeylang.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** Represents an unexpected or unknown character. */
    ILLEGAL("Illegal"),
    /** Represents the end of the source text. */
    EOF("Eof"),

    // Identifiers & literals.
    /** An identifier, such as a variable or parameter name. */
    IDENT("Ident"),
    /** A 64-bit integer literal. */
    INT("Int"),
    /** The boolean literals {@code true} and {@code false}. */
    BOOL("Bool"),

    // Operators.
    ASSIGN("Assign"),
    PLUS("Plus"),
    MINUS("Minus"),
    BANG("Bang"),
    ASTERISK("Asterisk"),
    SLASH("Slash"),
    EQUAL("Equal"),
    NOT_EQUAL("NotEqual"),
    LESS_THAN("LessThan"),
    LESS_EQUAL("LessEqual"),
    GREATER_THAN("GreaterThan"),
    GREATER_EQUAL("GreaterEqual"),

    // Delimiters.
    COMMA("Comma"),
    SEMICOLON("Semicolon"),
    LPAREN("Lparen"),
    RPAREN("Rparen"),
    LBRACE("Lbrace"),
    RBRACE("Rbrace"),

    // Keywords.
    FUNCTION("Function"),
    LET("Let"),
    IF("If"),
    ELSE("Else"),
    RETURN("Return");

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", FUNCTION,
            "let", LET,
            "if", IF,
            "else", ELSE,
            "return", RETURN,
            "true", BOOL,
            "false", BOOL
    );

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used for this type in diagnostics, e.g. {@code Assign}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks up the keyword type for a scanned word.
     * @param word The identifier-shaped word.
     * @return The keyword type, or empty if the word is a plain identifier.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
