package org.monkeylang.runtime;

import org.monkeylang.compiler.frontend.lexer.Lexer;
import org.monkeylang.compiler.frontend.parser.Parser;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.runtime.model.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs source texts against one persistent top-level scope.
 * <p>
 * Each call to {@link #run(String)} lexes and parses the text with a fresh lexer and parser. If
 * the parser reports errors the text is rejected as a whole; otherwise the program is evaluated
 * and its bindings stay visible to later runs.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final Environment globals;
    private final Evaluator evaluator;

    public Interpreter() {
        this(EvaluatorOptions.defaults());
    }

    public Interpreter(EvaluatorOptions options) {
        this.globals = new Environment();
        this.evaluator = new Evaluator(globals, options);
    }

    /**
     * Parses a source text without evaluating it.
     * @param source The source text.
     * @return The program together with the parser holding its errors.
     */
    public static ParsedSource parse(String source) {
        Parser parser = new Parser(new Lexer(source));
        Program program = parser.parseProgram();
        return new ParsedSource(program, parser);
    }

    /**
     * Parses and, if there are no parse errors, evaluates a source text.
     * @param source The source text.
     * @return The parse errors or the evaluation result.
     */
    public EvaluationResult run(String source) {
        ParsedSource parsed = parse(source);
        if (parsed.parser().hasErrors()) {
            LOG.debug("Rejected input with {} parse error(s)", parsed.parser().getErrors().size());
            return EvaluationResult.rejected(parsed.parser().getErrors());
        }
        return execute(parsed.program());
    }

    /**
     * Evaluates an already parsed program.
     * @param program The program.
     * @return The evaluation result.
     */
    public EvaluationResult execute(Program program) {
        return EvaluationResult.evaluated(evaluator.eval(program));
    }

    /**
     * Returns the persistent top-level scope.
     */
    Environment getGlobals() {
        return globals;
    }

    /**
     * A parsed program together with the parser that produced it.
     *
     * @param program The parsed program.
     * @param parser The parser, for access to its errors.
     */
    public record ParsedSource(Program program, Parser parser) {
    }
}
