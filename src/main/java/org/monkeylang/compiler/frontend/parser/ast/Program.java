package org.monkeylang.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The root of the AST: the top-level statements of one parsed source text.
 *
 * @param statements The statements in source order.
 */
public record Program(List<Statement> statements) implements AstNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public String toSource() {
        return statements.stream()
                .map(AstNode::toSource)
                .collect(Collectors.joining("\n"));
    }
}
