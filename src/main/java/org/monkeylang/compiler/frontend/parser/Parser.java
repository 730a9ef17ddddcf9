package org.monkeylang.compiler.frontend.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.monkeylang.compiler.frontend.lexer.Lexer;
import org.monkeylang.compiler.frontend.lexer.Token;
import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.ast.BlockStatement;
import org.monkeylang.compiler.frontend.parser.ast.Expression;
import org.monkeylang.compiler.frontend.parser.ast.ExpressionStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.frontend.parser.ast.ReturnStatement;
import org.monkeylang.compiler.frontend.parser.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A precedence-climbing (Pratt) parser that builds a {@link Program} from the tokens of a
 * {@link Lexer}.
 * <p>
 * The parser keeps a current token and a one-token lookahead. Statements are dispatched on the
 * current token; expressions are built by a prefix rule followed by a loop that absorbs infix
 * operators while they bind tighter than the caller's threshold. Errors are collected in
 * {@link #getErrors()}: a malformed construct is dropped and parsing resumes at the next token.
 * An illegal token in expression position is reported; any other token that cannot start an
 * expression is skipped silently.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final ParseletRegistry registry;
    private final List<ParseError> errors = new ArrayList<>();

    private Token current;
    private Token peek;

    /**
     * Creates a parser with the built-in parselets.
     * @param lexer The token source.
     */
    public Parser(Lexer lexer) {
        this(lexer, ParseletRegistry.initialize());
    }

    /**
     * Creates a parser with a custom parselet registry.
     * @param lexer    The token source.
     * @param registry The prefix and infix rules.
     */
    public Parser(Lexer lexer, ParseletRegistry registry) {
        this.lexer = lexer;
        this.registry = registry;
        this.peek = lexer.nextToken();
        advance();
    }

    /**
     * Parses statements until the end of input.
     * @return The program; statements that failed to parse are absent from it.
     */
    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();

        while (!current.is(TokenType.EOF)) {
            try {
                parseStatement().ifPresent(statements::add);
            } catch (StackOverflowError e) {
                // The rest of the input cannot be resynchronised reliably.
                errors.add(new ParseError(ParseError.Kind.NESTING_TOO_DEEP,
                        "expression nesting too deep near " + current.line() + ":" + current.column(),
                        current.line(), current.column()));
                break;
            }
            advance();
        }

        LOG.debug("Parsed {} statement(s) with {} error(s)", statements.size(), errors.size());
        return new Program(statements);
    }

    /**
     * Returns the errors recorded so far, in the order they were found.
     */
    public List<ParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private Optional<Statement> parseStatement() {
        return switch (current.type()) {
            case LET -> Optional.ofNullable(parseLetStatement());
            case RETURN -> Optional.ofNullable(parseReturnStatement());
            default -> Optional.ofNullable(parseExpressionStatement());
        };
    }

    private Statement parseLetStatement() {
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        Identifier name = new Identifier(current.text());

        if (!expectPeek(TokenType.ASSIGN)) {
            return null;
        }
        advance();

        Expression value = parseExpression(Precedence.LOWEST);
        if (value == null) {
            return null;
        }
        skipOptionalSemicolon();
        return new LetStatement(name, value);
    }

    private Statement parseReturnStatement() {
        advance(); // consume 'return'

        Expression value = parseExpression(Precedence.LOWEST);
        if (value == null) {
            return null;
        }
        skipOptionalSemicolon();
        return new ReturnStatement(value);
    }

    private Statement parseExpressionStatement() {
        Expression expression = parseExpression(Precedence.LOWEST);
        if (expression == null) {
            return null;
        }
        skipOptionalSemicolon();
        return new ExpressionStatement(expression);
    }

    private void skipOptionalSemicolon() {
        if (peekIs(TokenType.SEMICOLON)) {
            advance();
        }
    }

    @Override
    public BlockStatement parseBlock() {
        advance(); // consume '{'

        List<Statement> statements = new ArrayList<>();
        while (!current.is(TokenType.RBRACE) && !current.is(TokenType.EOF)) {
            parseStatement().ifPresent(statements::add);
            advance();
        }
        return new BlockStatement(statements);
    }

    @Override
    public Expression parseExpression(Precedence precedence) {
        Optional<IPrefixParselet> prefix = registry.prefix(current.type());
        if (prefix.isEmpty()) {
            if (current.is(TokenType.ILLEGAL)) {
                errors.add(new ParseError(ParseError.Kind.ILLEGAL_TOKEN,
                        "cannot read '" + current.text() + "' at " + current.line() + ":" + current.column(),
                        current.line(), current.column()));
                return null;
            }
            LOG.trace("No prefix rule for {} at {}:{}", current.describe(), current.line(), current.column());
            return null;
        }

        Expression left = prefix.get().parse(this);

        while (left != null && !peekIs(TokenType.SEMICOLON)
                && precedence.isLowerThan(registry.precedenceOf(peek.type()))) {
            Optional<IInfixParselet> infix = registry.infix(peek.type());
            if (infix.isEmpty()) {
                return left;
            }
            advance();
            left = infix.get().parse(this, left);
        }

        return left;
    }

    @Override
    public Token current() {
        return current;
    }

    @Override
    public Token peek() {
        return peek;
    }

    @Override
    public Token advance() {
        current = peek;
        peek = lexer.nextToken();
        return current;
    }

    @Override
    public boolean peekIs(TokenType type) {
        return peek.is(type);
    }

    @Override
    public boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            advance();
            return true;
        }
        errors.add(new ParseError(
                ParseError.Kind.UNEXPECTED_TOKEN,
                "expected next token to be " + type.displayName() + ", got " + peek.describe() + " instead",
                peek.line(),
                peek.column()));
        return false;
    }
}
