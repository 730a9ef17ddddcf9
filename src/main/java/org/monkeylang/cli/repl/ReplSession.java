package org.monkeylang.cli.repl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

import org.monkeylang.compiler.frontend.parser.ParseError;
import org.monkeylang.runtime.EvaluationResult;
import org.monkeylang.runtime.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads source lines one at a time and runs each against the same {@link Interpreter}, so names
 * bound on one line stay visible on the following lines.
 * <p>
 * A line with parse errors is reported and skipped without evaluation. Otherwise the value
 * produced by the line, if any, is printed followed by an empty line.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);

    static final String BANNER = "Hello! This is the Monkey programming language!\n"
            + "Feel free to type in commands\n";
    static final String FAREWELL = "Bye :)";

    private final Interpreter interpreter;
    private final BufferedReader in;
    private final PrintWriter out;
    private final String prompt;
    private final boolean showBanner;

    /**
     * @param interpreter the interpreter holding the session's top-level scope.
     * @param in          source of input lines.
     * @param out         destination for prompts, values and parse errors.
     * @param prompt      text printed before reading each line.
     * @param showBanner  whether to greet the user before the first prompt.
     */
    public ReplSession(Interpreter interpreter, BufferedReader in, PrintWriter out,
                       String prompt, boolean showBanner) {
        this.interpreter = interpreter;
        this.in = in;
        this.out = out;
        this.prompt = prompt;
        this.showBanner = showBanner;
    }

    /**
     * Runs the read-eval-print loop until the input is exhausted.
     *
     * @return the number of lines that were evaluated.
     * @throws IOException if reading from the input fails.
     */
    public int run() throws IOException {
        if (showBanner) {
            out.println(BANNER);
        }

        int evaluated = 0;
        while (true) {
            out.print(prompt);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println(FAREWELL);
                out.flush();
                return evaluated;
            }
            if (line.isBlank()) {
                continue;
            }

            if (evaluate(line)) {
                evaluated++;
            }
        }
    }

    /**
     * Runs a single line and prints its outcome.
     *
     * @param line the source line.
     * @return true if the line was evaluated, false if it was rejected by the parser.
     */
    public boolean evaluate(String line) {
        EvaluationResult result = interpreter.run(line);

        if (result.hasParseErrors()) {
            LOG.debug("Skipping line with {} parse error(s)", result.parseErrors().size());
            for (ParseError error : result.parseErrors()) {
                out.println(error);
            }
            out.flush();
            return false;
        }

        result.value().ifPresent(value -> {
            out.println(value.inspect());
            out.println();
        });
        out.flush();
        return true;
    }
}
