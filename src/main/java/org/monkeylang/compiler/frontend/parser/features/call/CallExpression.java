package org.monkeylang.compiler.frontend.parser.features.call;

import java.util.List;
import java.util.stream.Collectors;

import org.monkeylang.compiler.frontend.parser.ast.AstNode;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * A function application: {@code callee(arg1, arg2)}.
 *
 * @param function The expression producing the function to call.
 * @param arguments The argument expressions in source order.
 */
public record CallExpression(Expression function, List<Expression> arguments) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String toSource() {
        return function.toSource() + arguments.stream()
                .map(AstNode::toSource)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
