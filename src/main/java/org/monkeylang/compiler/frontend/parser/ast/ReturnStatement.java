package org.monkeylang.compiler.frontend.parser.ast;

/**
 * Leaves the enclosing function (or program) with a value: {@code return x;}.
 *
 * @param value The returned expression.
 */
public record ReturnStatement(Expression value) implements Statement {

    @Override
    public String toSource() {
        return "return " + value.toSource() + ";";
    }
}
