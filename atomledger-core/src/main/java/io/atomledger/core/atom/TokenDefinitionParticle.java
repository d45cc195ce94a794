package io.atomledger.core.atom;

import io.atomledger.core.UInt256;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Defines a token class: its name, description and the smallest transferable unit.
 *
 * <p>Requires {@link IdentifiableQuark} (the token's resource identifier), {@link OwnableQuark}
 * and {@link AccountableQuark}.
 */
public record TokenDefinitionParticle(String name, String description, UInt256 granularity, List<Quark> quarks)
        implements Particle {

    private static final Set<Class<? extends Quark>> REQUIRED =
            Set.of(IdentifiableQuark.class, OwnableQuark.class, AccountableQuark.class);

    public TokenDefinitionParticle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(granularity, "granularity");
        if (granularity.isZero()) {
            throw new IllegalArgumentException("granularity must be positive");
        }
        quarks = Quarks.check("TokenDefinitionParticle", quarks, REQUIRED, Set.of());
    }

    public static TokenDefinitionParticle of(String name, String description, UInt256 granularity,
                                             IdentifiableQuark id, OwnableQuark owner, AccountableQuark accountable) {
        return new TokenDefinitionParticle(name, description, granularity, List.of(id, owner, accountable));
    }

    public String tokenReference() {
        return requireQuark(IdentifiableQuark.class).id();
    }
}
