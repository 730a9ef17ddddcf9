package org.monkeylang.compiler.frontend.parser.features.literal;

import org.monkeylang.compiler.frontend.lexer.Token;
import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.Expression;

/**
 * Parses integer and boolean literals from the value decoded by the lexer.
 */
public class LiteralParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        Token token = context.current();
        return switch (token.type()) {
            case INT -> new IntegerLiteral((Long) token.value());
            case BOOL -> new BooleanLiteral((Boolean) token.value());
            default -> throw new IllegalStateException("Not a literal token: " + token.describe());
        };
    }
}
