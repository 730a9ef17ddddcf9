package org.monkeylang.compiler.frontend.parser.features.infix;

import org.monkeylang.compiler.frontend.parser.IInfixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses a binary operator. The right operand is parsed at the operator's own precedence;
 * together with the strict comparison in the parser's infix loop this makes every binary
 * operator left-associative.
 */
public class InfixOperatorParselet implements IInfixParselet {

    private final Precedence precedence;

    public InfixOperatorParselet(Precedence precedence) {
        this.precedence = precedence;
    }

    @Override
    public Expression parse(ParsingContext context, Expression left) {
        InfixOperator operator = InfixOperator.of(context.current().type());
        context.advance();

        Expression right = context.parseExpression(precedence);
        if (right == null) {
            return null;
        }
        return new InfixExpression(operator, left, right);
    }

    @Override
    public Precedence precedence() {
        return precedence;
    }
}
