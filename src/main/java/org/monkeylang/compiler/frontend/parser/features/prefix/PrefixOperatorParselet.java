package org.monkeylang.compiler.frontend.parser.features.prefix;

import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.Precedence;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses {@code !operand} and {@code -operand}. The operand is parsed at
 * {@link Precedence#PREFIX}, so only calls bind tighter than the operator.
 */
public class PrefixOperatorParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        PrefixOperator operator = PrefixOperator.of(context.current().type());
        context.advance();

        Expression right = context.parseExpression(Precedence.PREFIX);
        if (right == null) {
            return null;
        }
        return new PrefixExpression(operator, right);
    }
}
