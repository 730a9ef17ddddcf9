package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses an expression that continues an already parsed left-hand side
 * (binary operators and calls). The operator token is the current token when
 * {@link #parse(ParsingContext, Expression)} is invoked.
 */
public interface IInfixParselet {

    /**
     * Parses the rest of the construct.
     *
     * @param context The parsing context providing access to the token stream.
     * @param left The expression parsed so far.
     * @return The combined expression, or {@code null} if the construct is malformed.
     */
    Expression parse(ParsingContext context, Expression left);

    /**
     * Returns how tightly the operator binds to its left operand.
     */
    Precedence precedence();
}
