package org.monkeylang.compiler.frontend.parser.features.prefix;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A unary operator applied to an operand, e.g. {@code -x} or {@code !ok}.
 *
 * @param operator The operator.
 * @param right The operand.
 */
public record PrefixExpression(PrefixOperator operator, Expression right) implements Expression {

    @Override
    public String toSource() {
        return "(" + operator.symbol() + right.toSource() + ")";
    }
}
