package io.atomledger.core.atom;

import io.atomledger.core.Bytes;
import io.atomledger.core.EUID;
import io.atomledger.core.serialization.Serialization;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The unit of submission: a set of particles plus optional timestamp annotations and signatures.
 *
 * <p>Signatures are carried on the wire only, so attaching one never changes the atom's hash or
 * {@code hid}. Particle order is kept for display but ignored by the canonical form.
 *
 * @param particles the particles, without duplicates
 * @param timestamps named timestamps in milliseconds, may be empty
 * @param signatures signatures keyed by signer identifier, may be empty
 */
public record Atom(List<Particle> particles, Map<String, Long> timestamps, Map<EUID, Bytes> signatures) {

    /**
     * Key used by {@link Builder#timestamp(long)}.
     */
    public static final String DEFAULT_TIMESTAMP = "default";

    public Atom {
        particles = List.copyOf(Objects.requireNonNull(particles, "particles"));
        Set<Particle> seen = new HashSet<>();
        for (Particle particle : particles) {
            if (!seen.add(particle)) {
                throw new IllegalArgumentException("duplicate particle: " + particle);
            }
        }
        timestamps = timestamps == null ? Map.of() : Map.copyOf(timestamps);
        signatures = signatures == null ? Map.of() : Map.copyOf(signatures);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The timestamp stored under {@link #DEFAULT_TIMESTAMP}, if any.
     */
    public Long timestamp() {
        return timestamps.get(DEFAULT_TIMESTAMP);
    }

    /**
     * Returns a copy of this atom carrying {@code signature} under {@code signerId}, replacing any
     * previous signature from the same signer.
     */
    public Atom withSignature(EUID signerId, Bytes signature) {
        Objects.requireNonNull(signerId, "signerId");
        Objects.requireNonNull(signature, "signature");
        Map<EUID, Bytes> copy = new LinkedHashMap<>(signatures);
        copy.put(signerId, signature);
        return new Atom(particles, timestamps, copy);
    }

    /**
     * Signs the canonical bytes of this atom and returns the signed copy.
     */
    public Atom sign(AtomSigner signer, Serialization serialization) {
        Objects.requireNonNull(signer, "signer");
        byte[] canonical = serialization.toCanonicalBytes(this);
        return withSignature(signer.id(), signer.sign(canonical));
    }

    /**
     * Builder for {@link Atom}.
     */
    public static final class Builder {
        private final List<Particle> particles = new ArrayList<>();
        private final Map<String, Long> timestamps = new LinkedHashMap<>();

        private Builder() {}

        public Builder particle(Particle particle) {
            particles.add(Objects.requireNonNull(particle, "particle"));
            return this;
        }

        public Builder particles(List<? extends Particle> particles) {
            particles.forEach(this::particle);
            return this;
        }

        public Builder timestamp(long millis) {
            return timestamp(DEFAULT_TIMESTAMP, millis);
        }

        public Builder timestamp(String key, long millis) {
            timestamps.put(Objects.requireNonNull(key, "key"), millis);
            return this;
        }

        public Atom build() {
            return new Atom(particles, timestamps, Map.of());
        }
    }
}
