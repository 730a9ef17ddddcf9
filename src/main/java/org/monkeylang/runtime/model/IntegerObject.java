package org.monkeylang.runtime.model;

/**
 * A 64-bit signed integer.
 *
 * @param value The integer value.
 */
public record IntegerObject(long value) implements MonkeyObject {

    @Override
    public ObjectType type() {
        return ObjectType.INTEGER;
    }

    @Override
    public String inspect() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return inspect();
    }
}
