package org.monkeylang.runtime.model;

/**
 * A runtime error. The message is the user-visible diagnostic, e.g.
 * {@code type mismatch: 5 + true}.
 *
 * @param message The error message.
 */
public record ErrorObject(String message) implements MonkeyObject {

    @Override
    public ObjectType type() {
        return ObjectType.ERROR;
    }

    @Override
    public String inspect() {
        return message;
    }
}
