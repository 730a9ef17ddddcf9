package org.monkeylang.runtime.model;

/**
 * The absence of a meaningful value, e.g. the result of calling a function whose body
 * produced nothing.
 */
public enum NullObject implements MonkeyObject {
    INSTANCE;

    @Override
    public ObjectType type() {
        return ObjectType.NULL;
    }

    @Override
    public String inspect() {
        return "null";
    }

    @Override
    public String toString() {
        return inspect();
    }
}
