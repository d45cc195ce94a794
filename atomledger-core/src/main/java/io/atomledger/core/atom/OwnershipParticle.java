package io.atomledger.core.atom;

import java.util.List;
import java.util.Set;

/**
 * Records that an identified, non-fungible resource belongs to an owner.
 */
public record OwnershipParticle(List<Quark> quarks) implements Particle {

    private static final Set<Class<? extends Quark>> REQUIRED =
            Set.of(IdentifiableQuark.class, OwnableQuark.class, AccountableQuark.class);

    public OwnershipParticle {
        quarks = Quarks.check("OwnershipParticle", quarks, REQUIRED, Set.of());
    }

    public static OwnershipParticle of(IdentifiableQuark id, OwnableQuark owner, AccountableQuark accountable) {
        return new OwnershipParticle(List.of(id, owner, accountable));
    }
}
