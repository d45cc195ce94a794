package io.atomledger.client;

import io.atomledger.core.atom.Atom;

import java.util.Map;
import java.util.Objects;

/**
 * One atom delivered to an address subscription.
 *
 * @param action what happened to the atom
 * @param atom the decoded atom
 * @param metadata extra information sent with the update, may be empty
 */
public record AtomUpdate(Action action, Atom atom, Map<String, Object> metadata) {
    public AtomUpdate {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(atom, "atom");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public enum Action {
        STORE,
        DELETE
    }
}
