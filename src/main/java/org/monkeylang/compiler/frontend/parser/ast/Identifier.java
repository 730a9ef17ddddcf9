package org.monkeylang.compiler.frontend.parser.ast;

/**
 * A name reference, used both as an expression and as the binding target of
 * {@code let} statements and function parameters.
 *
 * @param name The identifier text.
 */
public record Identifier(String name) implements Expression {

    @Override
    public String toSource() {
        return name;
    }
}
