package org.monkeylang.compiler.frontend.parser.features.call;

import java.util.ArrayList;
import java.util.List;

import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.IInfixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses the argument list of a call. The opening parenthesis is the current token;
 * an immediately following {@code )} yields a call without arguments.
 */
public class CallParselet implements IInfixParselet {

    @Override
    public Expression parse(ParsingContext context, Expression function) {
        List<Expression> arguments = parseArguments(context);
        if (arguments == null) {
            return null;
        }
        return new CallExpression(function, arguments);
    }

    @Override
    public Precedence precedence() {
        return Precedence.CALL;
    }

    private List<Expression> parseArguments(ParsingContext context) {
        List<Expression> arguments = new ArrayList<>();

        if (context.peekIs(TokenType.RPAREN)) {
            context.advance();
            return arguments;
        }

        context.advance();
        Expression first = context.parseExpression(Precedence.LOWEST);
        if (first == null) {
            return null;
        }
        arguments.add(first);

        while (context.peekIs(TokenType.COMMA)) {
            context.advance();
            context.advance();
            Expression next = context.parseExpression(Precedence.LOWEST);
            if (next == null) {
                return null;
            }
            arguments.add(next);
        }

        if (!context.expectPeek(TokenType.RPAREN)) {
            return null;
        }
        return arguments;
    }
}
