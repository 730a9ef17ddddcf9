package org.monkeylang.compiler.frontend.parser.features.infix;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A binary operator applied to two operands, e.g. {@code a + b}.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 */
public record InfixExpression(InfixOperator operator, Expression left, Expression right) implements Expression {

    @Override
    public String toSource() {
        return "(" + left.toSource() + " " + operator.symbol() + " " + right.toSource() + ")";
    }
}
