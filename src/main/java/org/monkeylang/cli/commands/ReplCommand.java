package org.monkeylang.cli.commands;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.monkeylang.cli.CommandLineInterface;
import org.monkeylang.cli.repl.ReplSession;
import org.monkeylang.runtime.EvaluatorOptions;
import org.monkeylang.runtime.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that reads programs line by line from standard input.
 * All lines share one top-level scope.
 */
@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Start an interactive session reading one line at a time from standard input"
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    @Option(
        names = {"--no-banner"},
        description = "Do not print the welcome banner"
    )
    private boolean noBanner;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        String prompt = config.getString("monkey.repl.prompt");
        boolean showBanner = !noBanner && config.getBoolean("monkey.repl.show-banner");

        Interpreter interpreter = new Interpreter(EvaluatorOptions.fromConfig(config));
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ReplSession session = new ReplSession(interpreter, in, spec.commandLine().getOut(), prompt, showBanner);

        try {
            int lines = session.run();
            log.debug("REPL session ended after {} evaluated line(s)", lines);
            return 0;
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
