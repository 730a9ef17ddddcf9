package org.monkeylang.compiler.frontend.parser.features.ident;

import org.monkeylang.compiler.frontend.parser.IPrefixParselet;
import org.monkeylang.compiler.frontend.parser.ParsingContext;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;

/**
 * Parses a bare name reference.
 */
public class IdentifierParselet implements IPrefixParselet {

    @Override
    public Expression parse(ParsingContext context) {
        return new Identifier(context.current().text());
    }
}
