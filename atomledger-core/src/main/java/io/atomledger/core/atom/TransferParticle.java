package io.atomledger.core.atom;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A quantity of a token held by one owner.
 *
 * <p>Requires {@link FungibleQuark}, {@link OwnableQuark} and {@link AccountableQuark}.
 */
public record TransferParticle(String tokenReference, List<Quark> quarks) implements Particle {

    private static final Set<Class<? extends Quark>> REQUIRED =
            Set.of(FungibleQuark.class, OwnableQuark.class, AccountableQuark.class);

    public TransferParticle {
        Objects.requireNonNull(tokenReference, "tokenReference");
        quarks = Quarks.check("TransferParticle", quarks, REQUIRED, Set.of());
    }

    public static TransferParticle of(String tokenReference, FungibleQuark fungible, OwnableQuark owner,
                                      AccountableQuark accountable) {
        return new TransferParticle(tokenReference, List.of(fungible, owner, accountable));
    }

    public FungibleQuark fungible() {
        return requireQuark(FungibleQuark.class);
    }

    public OwnableQuark owner() {
        return requireQuark(OwnableQuark.class);
    }
}
