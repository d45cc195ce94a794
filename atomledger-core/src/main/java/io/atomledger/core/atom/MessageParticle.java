package io.atomledger.core.atom;

import io.atomledger.core.Bytes;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An opaque payload sent from one address to another, with string metadata.
 *
 * <p>Requires {@link AccountableQuark}; may carry a {@link ChronoQuark}.
 */
public record MessageParticle(String from, String to, Bytes data, Map<String, String> metaData, List<Quark> quarks)
        implements Particle {

    private static final Set<Class<? extends Quark>> REQUIRED = Set.of(AccountableQuark.class);
    private static final Set<Class<? extends Quark>> OPTIONAL = Set.of(ChronoQuark.class);

    public MessageParticle {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(data, "data");
        metaData = metaData == null ? Map.of() : Map.copyOf(metaData);
        quarks = Quarks.check("MessageParticle", quarks, REQUIRED, OPTIONAL);
    }

    public static MessageParticle of(String from, String to, Bytes data) {
        return new MessageParticle(from, to, data, Map.of(), List.of(AccountableQuark.of(from, to)));
    }
}
