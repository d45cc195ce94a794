package io.atomledger.core.atom;

import java.util.List;
import java.util.Optional;

/**
 * An immutable unit of ledger state composed of quarks.
 *
 * <p>The set of variants is closed. Each variant decides which quark kinds it requires and checks
 * them on construction.
 */
public sealed interface Particle
        permits TokenDefinitionParticle, TransferParticle, OwnershipParticle, MessageParticle {

    /**
     * The quarks of this particle, in declaration order.
     */
    List<Quark> quarks();

    default <Q extends Quark> Optional<Q> quark(Class<Q> kind) {
        for (Quark quark : quarks()) {
            if (kind.isInstance(quark)) {
                return Optional.of(kind.cast(quark));
            }
        }
        return Optional.empty();
    }

    default <Q extends Quark> Q requireQuark(Class<Q> kind) {
        return quark(kind).orElseThrow(() ->
                new IllegalStateException(getClass().getSimpleName() + " has no " + kind.getSimpleName()));
    }

    /**
     * Addresses this particle is relevant to, from its {@link AccountableQuark}.
     */
    default List<String> addresses() {
        return quark(AccountableQuark.class).map(AccountableQuark::addresses).orElse(List.of());
    }
}
