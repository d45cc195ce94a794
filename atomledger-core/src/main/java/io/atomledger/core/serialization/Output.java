package io.atomledger.core.serialization;

/**
 * The external forms a field can be included in.
 */
public enum Output {
    /** Canonical binary form, used for hashing and signing. */
    DSON,
    /** JSON-shaped form, used for transport. */
    WIRE
}
