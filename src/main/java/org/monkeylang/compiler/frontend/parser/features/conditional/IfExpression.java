package org.monkeylang.compiler.frontend.parser.features.conditional;

import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A value-producing conditional: {@code if (condition) { ... } else { ... }}.
 *
 * @param condition The tested expression.
 * @param consequence The block evaluated when the condition is truthy.
 * @param alternative The block evaluated otherwise, or null if there is no {@code else}.
 */
public record IfExpression(
        Expression condition,
        BlockStatement consequence,
        BlockStatement alternative
) implements Expression {

    public boolean hasAlternative() {
        return alternative != null;
    }

    @Override
    public String toSource() {
        String source = "if (" + condition.toSource() + ") " + consequence.toSource();
        if (hasAlternative()) {
            source += " else " + alternative.toSource();
        }
        return source;
    }
}
