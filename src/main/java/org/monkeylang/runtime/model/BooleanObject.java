package org.monkeylang.runtime.model;

/**
 * A boolean. The two instances are shared; use {@link #of(boolean)} instead of the constructor.
 *
 * @param value The boolean value.
 */
public record BooleanObject(boolean value) implements MonkeyObject {

    public static final BooleanObject TRUE = new BooleanObject(true);
    public static final BooleanObject FALSE = new BooleanObject(false);

    public static BooleanObject of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ObjectType type() {
        return ObjectType.BOOLEAN;
    }

    @Override
    public String inspect() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return inspect();
    }
}
