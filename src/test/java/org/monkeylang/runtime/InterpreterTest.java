package org.monkeylang.runtime;

import org.monkeylang.runtime.model.ErrorObject;
import org.monkeylang.runtime.model.IntegerObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the {@link Interpreter} facade: persistent bindings across runs and rejection of
 * inputs with parse errors.
 */
@Tag("unit")
public class InterpreterTest {

    @Test
    void testBindingsPersistAcrossRuns() {
        Interpreter interpreter = new Interpreter();

        assertThat(interpreter.run("let add = fn(a, b) { a + b };").value()).isEmpty();
        assertThat(interpreter.run("let x = 40;").value()).isEmpty();

        EvaluationResult result = interpreter.run("add(x, 2)");

        assertThat(result.hasParseErrors()).isFalse();
        assertThat(result.value()).contains(new IntegerObject(42));
    }

    @Test
    void testParseErrorsSkipEvaluation() {
        Interpreter interpreter = new Interpreter();

        EvaluationResult result = interpreter.run("let x = 1; let y 2;");

        assertThat(result.hasParseErrors()).isTrue();
        assertThat(result.parseErrors()).hasSize(1);
        assertThat(result.value()).isEmpty();
        assertThat(interpreter.getGlobals().get("x")).isEmpty();
    }

    @Test
    void testRuntimeErrorIsReportedAsValue() {
        EvaluationResult result = new Interpreter().run("1 + true");

        assertThat(result.isRuntimeError()).isTrue();
        assertThat(result.value()).contains(new ErrorObject("type mismatch: 1 + true"));
    }

    @Test
    void testRuntimeErrorDoesNotDiscardEarlierBindings() {
        Interpreter interpreter = new Interpreter();

        interpreter.run("let kept = 1; kept + true; let lost = 2;");

        assertThat(interpreter.getGlobals().get("kept")).contains(new IntegerObject(1));
        assertThat(interpreter.getGlobals().get("lost")).isEmpty();
    }

    @Test
    void testOptionsFromConfig() {
        EvaluatorOptions options = EvaluatorOptions.fromConfig(
                ConfigFactory.parseString("monkey.evaluator.max-call-depth = 8"));

        assertThat(options.maxCallDepth()).isEqualTo(8);
        assertThat(EvaluatorOptions.fromConfig(ConfigFactory.empty()))
                .isEqualTo(EvaluatorOptions.defaults());
    }

    @Test
    void testNonPositiveCallDepthIsRejected() {
        assertThatThrownBy(() -> new EvaluatorOptions(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxCallDepth");
    }

    @Test
    void testConfiguredCallDepthApplies() {
        Interpreter interpreter = new Interpreter(new EvaluatorOptions(3));

        EvaluationResult result = interpreter.run("let f = fn(n) { if (n == 0) { 0 } else { f(n - 1) } }; f(5)");

        assertThat(result.value()).contains(new ErrorObject("maximum call depth exceeded: 3"));
    }
}
