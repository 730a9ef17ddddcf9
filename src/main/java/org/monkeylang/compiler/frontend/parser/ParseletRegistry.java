package org.monkeylang.compiler.frontend.parser;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.features.call.CallParselet;
import org.monkeylang.compiler.frontend.parser.features.conditional.IfExpressionParselet;
import org.monkeylang.compiler.frontend.parser.features.function.FunctionLiteralParselet;
import org.monkeylang.compiler.frontend.parser.features.group.GroupedExpressionParselet;
import org.monkeylang.compiler.frontend.parser.features.ident.IdentifierParselet;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixOperatorParselet;
import org.monkeylang.compiler.frontend.parser.features.literal.LiteralParselet;
import org.monkeylang.compiler.frontend.parser.features.prefix.PrefixOperatorParselet;

/**
 * Registry for expression parselets.
 * Maps token types to the prefix and infix rules that handle them.
 */
public class ParseletRegistry {

    private final Map<TokenType, IPrefixParselet> prefixParselets = new EnumMap<>(TokenType.class);
    private final Map<TokenType, IInfixParselet> infixParselets = new EnumMap<>(TokenType.class);

    /**
     * Registers the rule for expressions that start with the given token type.
     * @param type     The token type that introduces the expression.
     * @param parselet The parselet for this token type.
     */
    public void registerPrefix(TokenType type, IPrefixParselet parselet) {
        prefixParselets.put(type, parselet);
    }

    /**
     * Registers the rule for expressions that continue with the given token type.
     * @param type     The operator token type.
     * @param parselet The parselet for this token type.
     */
    public void registerInfix(TokenType type, IInfixParselet parselet) {
        infixParselets.put(type, parselet);
    }

    /**
     * Looks up the prefix rule for a token type.
     * @param type The token type.
     * @return The parselet, or empty if no expression can start with this token.
     */
    public Optional<IPrefixParselet> prefix(TokenType type) {
        return Optional.ofNullable(prefixParselets.get(type));
    }

    /**
     * Looks up the infix rule for a token type.
     * @param type The token type.
     * @return The parselet, or empty if the token does not continue an expression.
     */
    public Optional<IInfixParselet> infix(TokenType type) {
        return Optional.ofNullable(infixParselets.get(type));
    }

    /**
     * Returns the binding power of a token in infix position.
     * Tokens without an infix rule bind at {@link Precedence#LOWEST}.
     */
    public Precedence precedenceOf(TokenType type) {
        return infix(type).map(IInfixParselet::precedence).orElse(Precedence.LOWEST);
    }

    /**
     * Creates a registry with all built-in parselets.
     * @return A new registry instance.
     */
    public static ParseletRegistry initialize() {
        ParseletRegistry registry = new ParseletRegistry();

        registry.registerPrefix(TokenType.IDENT, new IdentifierParselet());
        LiteralParselet literal = new LiteralParselet();
        registry.registerPrefix(TokenType.INT, literal);
        registry.registerPrefix(TokenType.BOOL, literal);
        PrefixOperatorParselet prefixOperator = new PrefixOperatorParselet();
        registry.registerPrefix(TokenType.BANG, prefixOperator);
        registry.registerPrefix(TokenType.MINUS, prefixOperator);
        registry.registerPrefix(TokenType.LPAREN, new GroupedExpressionParselet());
        registry.registerPrefix(TokenType.IF, new IfExpressionParselet());
        registry.registerPrefix(TokenType.FUNCTION, new FunctionLiteralParselet());

        InfixOperatorParselet equals = new InfixOperatorParselet(Precedence.EQUALS);
        registry.registerInfix(TokenType.EQUAL, equals);
        registry.registerInfix(TokenType.NOT_EQUAL, equals);
        InfixOperatorParselet lessGreater = new InfixOperatorParselet(Precedence.LESS_GREATER);
        registry.registerInfix(TokenType.LESS_THAN, lessGreater);
        registry.registerInfix(TokenType.LESS_EQUAL, lessGreater);
        registry.registerInfix(TokenType.GREATER_THAN, lessGreater);
        registry.registerInfix(TokenType.GREATER_EQUAL, lessGreater);
        InfixOperatorParselet sum = new InfixOperatorParselet(Precedence.SUM);
        registry.registerInfix(TokenType.PLUS, sum);
        registry.registerInfix(TokenType.MINUS, sum);
        InfixOperatorParselet product = new InfixOperatorParselet(Precedence.PRODUCT);
        registry.registerInfix(TokenType.ASTERISK, product);
        registry.registerInfix(TokenType.SLASH, product);
        registry.registerInfix(TokenType.LPAREN, new CallParselet());

        return registry;
    }
}
