package org.monkeylang.cli.commands;

import org.monkeylang.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the run command.
 */
@Tag("unit")
public class RunCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("run");
    }

    @Test
    void testHelpOutput() {
        execute("run", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--file").contains("--expression").contains("--dump-ast");
    }

    @Test
    void testRunFile() throws Exception {
        Path sourceFile = tempDir.resolve("closures.mk");
        Files.writeString(sourceFile, """
                let newAdder = fn(x) {
                    fn(y) { x + y };
                };
                let addTwo = newAdder(2);
                addTwo(2);
                """);

        int exitCode = execute("run", "-f", sourceFile.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("4");
    }

    @Test
    void testDumpAstPrintsParenthesisedProgram() {
        int exitCode = execute("run", "--dump-ast", "-e", "1 + 2 * 3");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("(1 + (2 * 3))").contains("7");
    }

    @Test
    void testParseErrorsExitWithOne() {
        int exitCode = execute("run", "-e", "let x 5;");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_PARSE_ERROR);
        assertThat(err.toString()).contains("Unexpected Token: expected next token to be Assign, got Int(5) instead");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testRuntimeErrorExitsWithTwo() {
        int exitCode = execute("run", "-e", "5 + true");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("ERROR: type mismatch: 5 + true");
    }

    @Test
    void testDeepRecursionExitsWithRuntimeError() {
        int exitCode = execute("run", "-e",
                "let f = fn(n) { if (n == 0) { 0 } else { 1 + f(n - 1) } }; f(100000)");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("ERROR: maximum call depth exceeded: ");
    }

    @Test
    void testIllegalCharacterIsAParseError() {
        int exitCode = execute("run", "-e", "1 + \uD83D\uDE00");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_PARSE_ERROR);
        assertThat(err.toString()).contains("Illegal Token: cannot read '\uD83D\uDE00' at 1:5");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testProgramWithoutValuePrintsNothing() {
        int exitCode = execute("run", "-e", "let x = 1;");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testNonexistentFileReturnsError() {
        int exitCode = execute("run", "-f", tempDir.resolve("missing.mk").toString());

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void testSourceIsRequired() {
        int exitCode = execute("run");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("Missing required");
    }

    @Test
    void testFileAndExpressionAreMutuallyExclusive() {
        int exitCode = execute("run", "-f", "x.mk", "-e", "1");

        assertThat(exitCode).isNotEqualTo(0);
    }

    @Test
    void testConfiguredCallDepthIsUsed() throws Exception {
        Path configFile = tempDir.resolve("shallow.conf");
        Files.writeString(configFile, "monkey.evaluator.max-call-depth = 4\n");

        int exitCode = execute("--config", configFile.toString(),
                "run", "-e", "let f = fn(n) { if (n == 0) { 0 } else { f(n - 1) } }; f(10)");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("maximum call depth exceeded: 4");
    }

    @Test
    void testMissingConfigFileIsReported() {
        int exitCode = execute("--config", tempDir.resolve("nope.conf").toString(), "run", "-e", "1");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
