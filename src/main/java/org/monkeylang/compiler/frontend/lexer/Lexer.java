package org.monkeylang.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts source text into tokens, one at a time.
 * <p>
 * The lexer is a forward-only cursor over an immutable source string: once {@link TokenType#EOF}
 * has been produced, every further call to {@link #nextToken()} produces EOF again. To re-scan
 * the same text a new lexer must be created.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private int position = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a lexer over the given source text.
     * @param source The source code to scan.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the remaining source into a list of tokens.
     * @return The tokens, always terminated by exactly one EOF token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    /**
     * Produces the next token, skipping any whitespace before it.
     * @return The next token, or EOF at the end of the input.
     */
    public Token nextToken() {
        skipWhitespace();

        int startLine = line;
        int startColumn = column;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", startLine, startColumn);
        }

        char c = advance();
        switch (c) {
            case '=':
                return twoCharOperator('=', TokenType.EQUAL, TokenType.ASSIGN, c, startLine, startColumn);
            case '!':
                return twoCharOperator('=', TokenType.NOT_EQUAL, TokenType.BANG, c, startLine, startColumn);
            case '<':
                return twoCharOperator('=', TokenType.LESS_EQUAL, TokenType.LESS_THAN, c, startLine, startColumn);
            case '>':
                return twoCharOperator('=', TokenType.GREATER_EQUAL, TokenType.GREATER_THAN, c, startLine, startColumn);
            case '+': return single(TokenType.PLUS, c, startLine, startColumn);
            case '-': return single(TokenType.MINUS, c, startLine, startColumn);
            case '*': return single(TokenType.ASTERISK, c, startLine, startColumn);
            case '/': return single(TokenType.SLASH, c, startLine, startColumn);
            case ',': return single(TokenType.COMMA, c, startLine, startColumn);
            case ';': return single(TokenType.SEMICOLON, c, startLine, startColumn);
            case '(': return single(TokenType.LPAREN, c, startLine, startColumn);
            case ')': return single(TokenType.RPAREN, c, startLine, startColumn);
            case '{': return single(TokenType.LBRACE, c, startLine, startColumn);
            case '}': return single(TokenType.RBRACE, c, startLine, startColumn);
            default:
                if (isIdentifierStart(c)) {
                    return identifierOrKeyword(position - 1, startLine, startColumn);
                }
                if (isDigit(c)) {
                    return number(position - 1, startLine, startColumn);
                }
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                    advance();
                    return new Token(TokenType.ILLEGAL, source.substring(position - 2, position),
                            startLine, startColumn);
                }
                return single(TokenType.ILLEGAL, c, startLine, startColumn);
        }
    }

    private Token twoCharOperator(char expected, TokenType matched, TokenType fallback,
                                  char first, int startLine, int startColumn) {
        if (peek() == expected) {
            advance();
            return new Token(matched, String.valueOf(first) + expected, startLine, startColumn);
        }
        return single(fallback, first, startLine, startColumn);
    }

    private Token single(TokenType type, char c, int startLine, int startColumn) {
        return new Token(type, String.valueOf(c), startLine, startColumn);
    }

    private Token identifierOrKeyword(int start, int startLine, int startColumn) {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, position);
        return TokenType.keyword(text)
                .map(type -> type == TokenType.BOOL
                        ? new Token(type, text, Boolean.parseBoolean(text), startLine, startColumn)
                        : new Token(type, text, startLine, startColumn))
                .orElseGet(() -> new Token(TokenType.IDENT, text, startLine, startColumn));
    }

    private Token number(int start, int startLine, int startColumn) {
        while (isDigit(peek())) {
            advance();
        }
        String text = source.substring(start, position);
        try {
            return new Token(TokenType.INT, text, Long.parseLong(text), startLine, startColumn);
        } catch (NumberFormatException e) {
            LOG.debug("Integer literal '{}' at {}:{} does not fit in 64 bits", text, startLine, startColumn);
            return new Token(TokenType.ILLEGAL, text, startLine, startColumn);
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private char advance() {
        char c = source.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(position);
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
