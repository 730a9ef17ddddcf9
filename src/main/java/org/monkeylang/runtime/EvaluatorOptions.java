package org.monkeylang.runtime;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link Evaluator}.
 *
 * @param maxCallDepth The maximum number of nested function calls before evaluation fails
 *                     with a runtime error instead of exhausting the host stack.
 */
public record EvaluatorOptions(int maxCallDepth) {

    public static final int DEFAULT_MAX_CALL_DEPTH = 1024;

    public EvaluatorOptions {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive, was " + maxCallDepth);
        }
    }

    public static EvaluatorOptions defaults() {
        return new EvaluatorOptions(DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Reads the options from the {@code monkey.evaluator} block of the application configuration.
     * Missing keys fall back to the defaults.
     *
     * @param config The application configuration.
     * @return The evaluator options.
     */
    public static EvaluatorOptions fromConfig(Config config) {
        String path = "monkey.evaluator.max-call-depth";
        return new EvaluatorOptions(config.hasPath(path) ? config.getInt(path) : DEFAULT_MAX_CALL_DEPTH);
    }
}
