package org.monkeylang.runtime;

import java.util.List;
import java.util.Optional;

import org.monkeylang.compiler.frontend.parser.ParseError;
import org.monkeylang.runtime.model.MonkeyObject;

/**
 * The outcome of running one source text through the {@link Interpreter}.
 *
 * @param parseErrors The errors recorded by the parser. If non-empty, nothing was evaluated.
 * @param value The evaluated value, or empty if the program produced none or was not evaluated.
 */
public record EvaluationResult(List<ParseError> parseErrors, Optional<MonkeyObject> value) {

    public EvaluationResult {
        parseErrors = List.copyOf(parseErrors);
    }

    public static EvaluationResult rejected(List<ParseError> parseErrors) {
        return new EvaluationResult(parseErrors, Optional.empty());
    }

    public static EvaluationResult evaluated(Optional<MonkeyObject> value) {
        return new EvaluationResult(List.of(), value);
    }

    public boolean hasParseErrors() {
        return !parseErrors.isEmpty();
    }

    /**
     * Checks whether evaluation ended with a runtime error.
     */
    public boolean isRuntimeError() {
        return value.map(MonkeyObject::isError).orElse(false);
    }
}
