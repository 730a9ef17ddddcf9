package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses an expression that starts with the current token (literals, identifiers,
 * prefix operators, grouping, conditionals, function literals).
 */
@FunctionalInterface
public interface IPrefixParselet {

    /**
     * Parses the construct introduced by {@link ParsingContext#current()}.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The parsed expression, or {@code null} if the construct is malformed.
     *         In that case an error has been recorded by the failed expectation.
     */
    Expression parse(ParsingContext context);
}
