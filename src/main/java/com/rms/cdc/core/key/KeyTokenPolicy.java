package com.rms.cdc.core.key;

/**
 * What the {@link KeyFormatter} does with a token containing characters that
 * are not allowed in a key segment (the {@code .} delimiter among them).
 */
public enum KeyTokenPolicy {

    /** Fail key derivation for the change. */
    REJECT,

    /** Replace each disallowed character with {@code _}. */
    ESCAPE
}
