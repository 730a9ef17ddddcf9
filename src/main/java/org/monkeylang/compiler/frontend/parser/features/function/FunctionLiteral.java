package org.monkeylang.compiler.frontend.parser.features.function;

import java.util.List;
import java.util.stream.Collectors;

import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;

/**
 * An anonymous function: {@code fn(x, y) { x + y }}.
 *
 * @param parameters The parameter names in declaration order.
 * @param body The function body.
 */
public record FunctionLiteral(List<Identifier> parameters, BlockStatement body) implements Expression {

    public FunctionLiteral {
        parameters = List.copyOf(parameters);
    }

    @Override
    public String toSource() {
        return parameters.stream()
                .map(Identifier::toSource)
                .collect(Collectors.joining(", ", "fn(", ") "))
                + body.toSource();
    }
}
