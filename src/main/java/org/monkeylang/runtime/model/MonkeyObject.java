package org.monkeylang.runtime.model;

/**
 * A value produced by the evaluator.
 * <p>
 * {@link ReturnValue} and {@link ErrorObject} are control-flow carriers: they travel up through
 * block evaluation and are never bound to a name or passed to a function.
 */
public interface MonkeyObject {

    /**
     * Returns the runtime type tag.
     */
    ObjectType type();

    /**
     * Returns the textual form shown to users, e.g. {@code 5}, {@code true} or {@code fn(x) { ... }}.
     */
    String inspect();

    /**
     * Checks whether this object is a runtime error.
     */
    default boolean isError() {
        return type() == ObjectType.ERROR;
    }
}
