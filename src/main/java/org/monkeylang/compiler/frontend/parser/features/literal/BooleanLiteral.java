package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A boolean literal, {@code true} or {@code false}.
 *
 * @param value The literal value.
 */
public record BooleanLiteral(boolean value) implements Expression {

    @Override
    public String toSource() {
        return Boolean.toString(value);
    }
}
