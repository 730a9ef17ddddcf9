package org.monkeylang.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.monkeylang.cli.CommandLineInterface;
import org.monkeylang.compiler.frontend.parser.ParseError;
import org.monkeylang.runtime.EvaluationResult;
import org.monkeylang.runtime.EvaluatorOptions;
import org.monkeylang.runtime.Interpreter;
import org.monkeylang.runtime.model.MonkeyObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs a whole program, read from a file or given inline.
 * <p>
 * Exit codes: 0 on success, 1 for parse errors or unreadable input, 2 if evaluation ended with a
 * runtime error.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Parse and evaluate a Monkey program"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_RUNTIME_ERROR = 2;

    /**
     * Mutually exclusive program sources: either --file or --expression.
     */
    static class SourceOptions {
        @Option(
            names = {"-f", "--file"},
            description = "Path to the source file to run"
        )
        Path file;

        @Option(
            names = {"-e", "--expression"},
            description = "Program text to run"
        )
        String expression;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    SourceOptions sourceOptions;

    @Option(
        names = {"--dump-ast"},
        description = "Print the parsed program in fully parenthesised form before evaluating it"
    )
    private boolean dumpAst;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            log.error("Failed to read {}: {}", sourceOptions.file, e.getMessage());
            err.println("Error: cannot read " + sourceOptions.file + ": " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }

        Interpreter.ParsedSource parsed = Interpreter.parse(source);
        if (parsed.parser().hasErrors()) {
            for (ParseError error : parsed.parser().getErrors()) {
                err.println(error);
            }
            return EXIT_PARSE_ERROR;
        }

        if (dumpAst) {
            out.println(parsed.program().toSource());
        }

        Interpreter interpreter = new Interpreter(EvaluatorOptions.fromConfig(parent.getConfig()));
        EvaluationResult result = interpreter.execute(parsed.program());

        if (result.isRuntimeError()) {
            err.println("ERROR: " + result.value().map(MonkeyObject::inspect).orElse(""));
            return EXIT_RUNTIME_ERROR;
        }
        result.value().ifPresent(value -> out.println(value.inspect()));
        return 0;
    }

    private String readSource() throws IOException {
        if (sourceOptions.expression != null) {
            return sourceOptions.expression;
        }
        log.debug("Reading program from {}", sourceOptions.file);
        return Files.readString(sourceOptions.file, StandardCharsets.UTF_8);
    }
}
