package org.monkeylang.compiler.frontend.parser.features.function;

import java.util.ArrayList;
import java.util.List;

import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;

/**
 * Parses {@code fn ( params ) { body }} where params is a possibly empty,
 * comma-separated list of identifiers.
 */
public class FunctionLiteralParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        if (!context.expectPeek(TokenType.LPAREN)) {
            return null;
        }

        List<Identifier> parameters = parseParameters(context);
        if (parameters == null) {
            return null;
        }

        if (!context.expectPeek(TokenType.LBRACE)) {
            return null;
        }
        return new FunctionLiteral(parameters, context.parseBlock());
    }

    private List<Identifier> parseParameters(ParsingContext context) {
        List<Identifier> parameters = new ArrayList<>();

        if (context.peekIs(TokenType.RPAREN)) {
            context.advance();
            return parameters;
        }

        if (!context.expectPeek(TokenType.IDENT)) {
            return null;
        }
        parameters.add(new Identifier(context.current().text()));

        while (context.peekIs(TokenType.COMMA)) {
            context.advance();
            if (!context.expectPeek(TokenType.IDENT)) {
                return null;
            }
            parameters.add(new Identifier(context.current().text()));
        }

        if (!context.expectPeek(TokenType.RPAREN)) {
            return null;
        }
        return parameters;
    }
}
