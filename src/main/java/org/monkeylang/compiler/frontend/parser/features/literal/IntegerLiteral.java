package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A 64-bit integer literal, e.g. {@code 42}.
 *
 * @param value The literal value.
 */
public record IntegerLiteral(long value) implements Expression {

    @Override
    public String toSource() {
        return Long.toString(value);
    }
}
