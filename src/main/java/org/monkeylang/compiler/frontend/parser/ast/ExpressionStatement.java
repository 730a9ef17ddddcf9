package org.monkeylang.compiler.frontend.parser.ast;

/**
 * A bare expression used as a statement. Its value becomes the value of the
 * enclosing block if it is the last statement evaluated.
 *
 * @param expression The wrapped expression.
 */
public record ExpressionStatement(Expression expression) implements Statement {

    @Override
    public String toSource() {
        return expression.toSource();
    }
}
