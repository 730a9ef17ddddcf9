package org.monkeylang.runtime.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A lexical scope mapping names to values, chained to an optional enclosing scope.
 * <p>
 * Lookups walk outward through the chain; bindings are always written to this scope and never
 * to an enclosing one. The chain only ever points toward ancestors, so it is acyclic. One
 * instance may be shared by several closures and call frames; a binding added through any of
 * them is visible to all.
 */
public class Environment {

    private final Map<String, MonkeyObject> bindings = new HashMap<>();
    private final Environment outer;

    /**
     * Creates a top-level scope.
     */
    public Environment() {
        this(null);
    }

    /**
     * Creates a scope nested in {@code outer}.
     * @param outer The enclosing scope, or null for a top-level scope.
     */
    public Environment(Environment outer) {
        this.outer = outer;
    }

    /**
     * Creates a child scope of this environment.
     */
    public Environment enclose() {
        return new Environment(this);
    }

    /**
     * Resolves a name, searching this scope first and then each enclosing scope.
     * @param name The name to resolve.
     * @return The bound value, or empty if no scope in the chain binds the name.
     */
    public Optional<MonkeyObject> get(String name) {
        for (Environment scope = this; scope != null; scope = scope.outer) {
            MonkeyObject value = scope.bindings.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Binds a name in this scope, replacing any previous binding of the same name here.
     * @param name The name to bind.
     * @param value The value to bind.
     * @return The bound value.
     */
    public MonkeyObject set(String name, MonkeyObject value) {
        bindings.put(name, value);
        return value;
    }

    /**
     * Returns the enclosing scope, or empty for a top-level scope.
     */
    Optional<Environment> getOuter() {
        return Optional.ofNullable(outer);
    }

    /**
     * Checks whether this scope itself (ignoring enclosing scopes) binds the name.
     */
    boolean isBoundLocally(String name) {
        return bindings.containsKey(name);
    }
}
