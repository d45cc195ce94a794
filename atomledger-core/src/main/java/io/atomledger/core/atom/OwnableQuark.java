package io.atomledger.core.atom;

import io.atomledger.core.Bytes;

import java.util.Objects;

/**
 * Gives a particle an owner, identified by public key.
 */
public record OwnableQuark(Bytes owner) implements Quark {
    public OwnableQuark {
        Objects.requireNonNull(owner, "owner");
        if (owner.length() == 0) {
            throw new IllegalArgumentException("owner must not be empty");
        }
    }
}
