package org.monkeylang.runtime.model;

/**
 * The runtime type tag of a {@link MonkeyObject}.
 */
public enum ObjectType {
    INTEGER,
    BOOLEAN,
    NULL,
    FUNCTION,
    /** Control-flow carrier for {@code return}; never visible to user programs. */
    RETURN_VALUE,
    /** Control-flow carrier for runtime errors; never visible to user programs. */
    ERROR
}
