package org.monkeylang.runtime.model;

import java.util.List;
import java.util.stream.Collectors;

import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;

/**
 * A closure: a function literal together with the environment that was active where the
 * literal was evaluated. The environment is shared, not copied, so later bindings in it are
 * visible to the function.
 *
 * @param parameters The parameter names.
 * @param body The function body.
 * @param environment The captured defining scope.
 */
public record FunctionObject(
        List<Identifier> parameters,
        BlockStatement body,
        Environment environment
) implements MonkeyObject {

    public FunctionObject {
        parameters = List.copyOf(parameters);
    }

    @Override
    public ObjectType type() {
        return ObjectType.FUNCTION;
    }

    @Override
    public String inspect() {
        return parameters.stream()
                .map(Identifier::name)
                .collect(Collectors.joining(", ", "fn(", ") { ... }"));
    }

    @Override
    public String toString() {
        return inspect();
    }
}
