package io.atomledger.core.atom;

/**
 * A facet attached to a {@link Particle}, granting it one capability.
 *
 * <p>Quarks are immutable records with structural equality; they carry data only.
 */
public sealed interface Quark
        permits FungibleQuark, OwnableQuark, IdentifiableQuark, AccountableQuark, ChronoQuark {
}
