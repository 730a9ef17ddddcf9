package org.monkeylang.compiler.frontend.parser.features.group;

import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses a parenthesised sub-expression. Grouping leaves no node of its own in the AST.
 */
public class GroupedExpressionParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        context.advance(); // consume '('

        Expression inner = context.parseExpression(Precedence.LOWEST);
        if (!context.expectPeek(TokenType.RPAREN)) {
            return null;
        }
        return inner;
    }
}
