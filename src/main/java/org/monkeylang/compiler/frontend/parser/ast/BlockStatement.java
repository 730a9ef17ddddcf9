package org.monkeylang.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered sequence of statements enclosed in braces, used as the body of
 * conditionals and function literals.
 *
 * @param statements The statements in source order.
 */
public record BlockStatement(List<Statement> statements) implements Statement {

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    @Override
    public String toSource() {
        if (statements.isEmpty()) {
            return "{ }";
        }
        return statements.stream()
                .map(AstNode::toSource)
                .collect(Collectors.joining(" ", "{ ", " }"));
    }
}
