package org.monkeylang.runtime.model;

/**
 * Wraps the value of a {@code return} statement while it propagates to the enclosing
 * function call or program.
 *
 * @param value The returned value.
 */
public record ReturnValue(MonkeyObject value) implements MonkeyObject {

    @Override
    public ObjectType type() {
        return ObjectType.RETURN_VALUE;
    }

    @Override
    public String inspect() {
        return value.inspect();
    }
}
