package org.monkeylang.compiler.frontend.parser;

import org.monkeylang.compiler.frontend.lexer.Lexer;
import org.monkeylang.compiler.frontend.lexer.TokenType;
import org.monkeylang.compiler.frontend.parser.ast.ExpressionStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.frontend.parser.ast.ReturnStatement;
import org.monkeylang.compiler.frontend.parser.ast.Statement;
import org.monkeylang.compiler.frontend.parser.features.call.CallExpression;
import org.monkeylang.compiler.frontend.parser.features.conditional.IfExpression;
import org.monkeylang.compiler.frontend.parser.features.function.FunctionLiteral;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixExpression;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixOperator;
import org.monkeylang.compiler.frontend.parser.features.infix.InfixOperatorParselet;
import org.monkeylang.compiler.frontend.parser.features.literal.BooleanLiteral;
import org.monkeylang.compiler.frontend.parser.features.literal.IntegerLiteral;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests statement parsing, operator precedence and associativity, and error recovery of the
 * {@link Parser}.
 */
@Tag("unit")
public class ParserTest {

    private static Program parseClean(String source) {
        Parser parser = new Parser(new Lexer(source));
        Program program = parser.parseProgram();
        assertThat(parser.getErrors())
                .describedAs("parse errors for '%s'", source)
                .isEmpty();
        return program;
    }

    @Test
    void testLetStatements() {
        Program program = parseClean("""
                let x = 5;
                let y = true;
                let foobar = y;
                """);

        assertThat(program.statements()).containsExactly(
                new LetStatement(new Identifier("x"), new IntegerLiteral(5)),
                new LetStatement(new Identifier("y"), new BooleanLiteral(true)),
                new LetStatement(new Identifier("foobar"), new Identifier("y"))
        );
    }

    @Test
    void testReturnStatements() {
        Program program = parseClean("return 5; return 10; return add(15);");

        assertThat(program.statements()).hasSize(3).allMatch(s -> s instanceof ReturnStatement);
        assertThat(program.toSource()).isEqualTo("return 5;\nreturn 10;\nreturn add(15);");
    }

    @Test
    void testSemicolonsAreOptional() {
        Program program = parseClean("let a = 1 let b = 2 a + b");

        assertThat(program.toSource()).isEqualTo("let a = 1;\nlet b = 2;\n(a + b)");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "-a * b                     | ((-a) * b)",
            "!-a                        | (!(-a))",
            "a + b + c                  | ((a + b) + c)",
            "a + b - c                  | ((a + b) - c)",
            "a * b * c                  | ((a * b) * c)",
            "a * b / c                  | ((a * b) / c)",
            "a + b / c                  | (a + (b / c))",
            "a + b * c + d / e - f      | (((a + (b * c)) + (d / e)) - f)",
            "5 > 4 == 3 < 4             | ((5 > 4) == (3 < 4))",
            "5 <= 4 != 3 >= 4           | ((5 <= 4) != (3 >= 4))",
            "3 + 4 * 5 == 3 * 1 + 4 * 5 | ((3 + (4 * 5)) == ((3 * 1) + (4 * 5)))",
            "true == !false             | (true == (!false))",
            "1 + (2 + 3) + 4            | ((1 + (2 + 3)) + 4)",
            "(5 + 5) * 2                | ((5 + 5) * 2)",
            "-(5 + 5)                   | (-(5 + 5))",
            "a + add(b * c) + d         | ((a + add((b * c))) + d)",
            "add(a, b, 1, 2 * 3, 4 + 5) | add(a, b, 1, (2 * 3), (4 + 5))",
            "-f(x)                      | (-f(x))",
            "f(x)(y)                    | f(x)(y)",
    })
    void testOperatorPrecedenceAndAssociativity(String source, String expected) {
        assertThat(parseClean(source).toSource()).isEqualTo(expected);
    }

    @Test
    void testEqualPrecedenceOperatorsAreLeftAssociative() {
        Program program = parseClean("a + b - c");

        ExpressionStatement statement = (ExpressionStatement) program.statements().get(0);
        InfixExpression outer = (InfixExpression) statement.expression();
        assertThat(outer.operator()).isEqualTo(InfixOperator.MINUS);
        assertThat(outer.right()).isEqualTo(new Identifier("c"));
        assertThat(outer.left()).isEqualTo(
                new InfixExpression(InfixOperator.PLUS, new Identifier("a"), new Identifier("b")));
    }

    @Test
    void testIfElseExpression() {
        Program program = parseClean("if (x < y) { x } else { y; z }");

        IfExpression ifExpression = (IfExpression) ((ExpressionStatement) program.statements().get(0)).expression();
        assertThat(ifExpression.condition().toSource()).isEqualTo("(x < y)");
        assertThat(ifExpression.consequence().statements()).hasSize(1);
        assertThat(ifExpression.hasAlternative()).isTrue();
        assertThat(ifExpression.alternative().statements()).hasSize(2);
    }

    @Test
    void testIfWithoutElse() {
        Program program = parseClean("if (x) { 1 }");

        IfExpression ifExpression = (IfExpression) ((ExpressionStatement) program.statements().get(0)).expression();
        assertThat(ifExpression.hasAlternative()).isFalse();
        assertThat(program.toSource()).isEqualTo("if (x) { 1 }");
    }

    @Test
    void testFunctionLiteralParameters() {
        assertThat(paramsOf("fn() {};")).isEmpty();
        assertThat(paramsOf("fn(x) {};")).containsExactly(new Identifier("x"));
        assertThat(paramsOf("fn(x, y, z) {};"))
                .containsExactly(new Identifier("x"), new Identifier("y"), new Identifier("z"));
    }

    private static List<Identifier> paramsOf(String source) {
        Statement statement = parseClean(source).statements().get(0);
        return ((FunctionLiteral) ((ExpressionStatement) statement).expression()).parameters();
    }

    @Test
    void testFunctionLiteralBody() {
        Program program = parseClean("fn(x, y) { x + y; }");

        assertThat(program.toSource()).isEqualTo("fn(x, y) { (x + y) }");
    }

    @Test
    void testCallExpression() {
        Program program = parseClean("add(1, 2 * 3, 4 + 5); noop()");

        CallExpression call = (CallExpression) ((ExpressionStatement) program.statements().get(0)).expression();
        assertThat(call.function()).isEqualTo(new Identifier("add"));
        assertThat(call.arguments()).extracting(a -> a.toSource())
                .containsExactly("1", "(2 * 3)", "(4 + 5)");

        CallExpression noop = (CallExpression) ((ExpressionStatement) program.statements().get(1)).expression();
        assertThat(noop.arguments()).isEmpty();
    }

    @Test
    void testUnterminatedBlockIsAcceptedAtEndOfInput() {
        Program program = parseClean("fn(x) { x + 1");

        assertThat(program.toSource()).isEqualTo("fn(x) { (x + 1) }");
    }

    @Test
    void testMissingAssignRecordsOneError() {
        Parser parser = new Parser(new Lexer("let x 5;"));

        Program program = parser.parseProgram();

        assertThat(parser.getErrors()).hasSize(1);
        ParseError error = parser.getErrors().get(0);
        assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
        assertThat(error.message()).isEqualTo("expected next token to be Assign, got Int(5) instead");
        assertThat(error.toString())
                .isEqualTo("Unexpected Token: expected next token to be Assign, got Int(5) instead");
        assertThat(error.line()).isEqualTo(1);
        assertThat(error.column()).isEqualTo(7);
        assertThat(program.statements()).noneMatch(s -> s instanceof LetStatement);
    }

    @Test
    void testMissingLetNameRecordsError() {
        Parser parser = new Parser(new Lexer("let = 5;"));

        parser.parseProgram();

        assertThat(parser.getErrors()).extracting(ParseError::message)
                .containsExactly("expected next token to be Ident, got Assign instead");
    }

    @Test
    void testEachMalformedConstructRecordsAnError() {
        Parser parser = new Parser(new Lexer("if x { 1 }; fn(x y) { x }; add(1, 2"));

        parser.parseProgram();

        assertThat(parser.getErrors()).extracting(ParseError::message).containsExactly(
                "expected next token to be Lparen, got Ident(x) instead",
                "expected next token to be Rparen, got Ident(y) instead",
                "expected next token to be Rparen, got Eof instead"
        );
    }

    @Test
    void testParsingResumesAfterMalformedStatement() {
        Parser parser = new Parser(new Lexer("let x 5; let y = 10;"));

        Program program = parser.parseProgram();

        assertThat(parser.hasErrors()).isTrue();
        assertThat(program.statements())
                .contains(new LetStatement(new Identifier("y"), new IntegerLiteral(10)));
    }

    @Test
    void testTokenWithoutPrefixRuleYieldsNoStatementAndNoError() {
        Parser parser = new Parser(new Lexer(")"));

        Program program = parser.parseProgram();

        assertThat(parser.getErrors()).isEmpty();
        assertThat(program.statements()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "@                        | cannot read '@' at 1:1",
            "1 + #                    | cannot read '#' at 1:5",
            "-9223372036854775808     | cannot read '9223372036854775808' at 1:2",
            "let x = \u00a7;         | cannot read '\u00a7' at 1:9",
    })
    void testIllegalTokenInExpressionIsReported(String source, String message) {
        Parser parser = new Parser(new Lexer(source));

        Program program = parser.parseProgram();

        assertThat(parser.getErrors()).hasSize(1);
        assertThat(parser.getErrors().get(0).kind()).isEqualTo(ParseError.Kind.ILLEGAL_TOKEN);
        assertThat(parser.getErrors().get(0).message()).isEqualTo(message);
        assertThat(program.statements()).isEmpty();
    }

    @Test
    void testIllegalTokenErrorRendersWithKind() {
        Parser parser = new Parser(new Lexer("\uD83D\uDE00"));

        parser.parseProgram();

        assertThat(parser.getErrors()).extracting(ParseError::toString)
                .containsExactly("Illegal Token: cannot read '\uD83D\uDE00' at 1:1");
    }

    @Test
    void testDeeplyNestedInputIsReportedInsteadOfOverflowing() {
        int depth = 200_000;
        String source = "(".repeat(depth) + "1" + ")".repeat(depth);
        Parser parser = new Parser(new Lexer(source));

        parser.parseProgram();

        assertThat(parser.getErrors()).hasSize(1);
        assertThat(parser.getErrors().get(0).kind()).isEqualTo(ParseError.Kind.NESTING_TOO_DEEP);
    }

    @Test
    void testInfixRuleAtLowestPrecedenceIsNeverAbsorbed() {
        ParseletRegistry registry = ParseletRegistry.initialize();
        registry.registerInfix(TokenType.LPAREN, new InfixOperatorParselet(Precedence.LOWEST));

        Parser parser = new Parser(new Lexer("f(x)"), registry);
        Program program = parser.parseProgram();

        // With LOWEST precedence '(' is never absorbed: 'f' and '(x)' become separate statements.
        assertThat(program.toSource()).isEqualTo("f\nx");
    }
}
