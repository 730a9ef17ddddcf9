package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.lexer.Token;
import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Provides parselets with access to the token stream and to the recursive entry points of
 * the parser. This interface decouples parselets from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Returns the token currently being parsed.
     */
    Token current();

    /**
     * Returns the one-token lookahead without consuming it.
     */
    Token peek();

    /**
     * Shifts the lookahead into the current position and pulls a new lookahead from the lexer.
     * @return The new current token.
     */
    Token advance();

    /**
     * Checks if the lookahead token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the lookahead is of the given type.
     */
    boolean peekIs(TokenType type);

    /**
     * Advances if the lookahead token is of the expected type. If not, records an
     * {@link ParseError.Kind#UNEXPECTED_TOKEN} error naming the expected and observed tokens.
     * @param type The expected token type.
     * @return true if the token matched and was consumed, false otherwise.
     */
    boolean expectPeek(TokenType type);

    /**
     * Parses an expression starting at the current token.
     * @param precedence The minimum binding power an infix operator needs to be absorbed.
     * @return The parsed expression, or {@code null} if no expression could be built.
     */
    Expression parseExpression(Precedence precedence);

    /**
     * Parses the statements of a block. The current token must be the opening brace.
     * Parsing stops at the closing brace or at the end of input.
     * @return The parsed block, never null.
     */
    BlockStatement parseBlock();
}
