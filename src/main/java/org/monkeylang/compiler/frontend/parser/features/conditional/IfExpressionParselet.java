package org.monkeylang.compiler.frontend.parser.features.conditional;

import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses {@code if ( condition ) { consequence }} with an optional {@code else { alternative }}.
 */
public class IfExpressionParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        if (!context.expectPeek(TokenType.LPAREN)) {
            return null;
        }
        context.advance();

        Expression condition = context.parseExpression(Precedence.LOWEST);
        if (condition == null) {
            return null;
        }

        if (!context.expectPeek(TokenType.RPAREN) || !context.expectPeek(TokenType.LBRACE)) {
            return null;
        }
        BlockStatement consequence = context.parseBlock();

        BlockStatement alternative = null;
        if (context.peekIs(TokenType.ELSE)) {
            context.advance();
            if (!context.expectPeek(TokenType.LBRACE)) {
                return null;
            }
            alternative = context.parseBlock();
        }

        return new IfExpression(condition, consequence, alternative);
    }
}
