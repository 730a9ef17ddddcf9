package org.monkeylang.compiler.frontend.parser.ast;

/**
 * Binds the value of an expression to a name in the active scope: {@code let x = 5;}.
 *
 * @param name The bound identifier.
 * @param value The expression producing the bound value.
 */
public record LetStatement(Identifier name, Expression value) implements Statement {

    @Override
    public String toSource() {
        return "let " + name.toSource() + " = " + value.toSource() + ";";
    }
}
