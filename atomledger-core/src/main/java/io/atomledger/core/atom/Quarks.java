package io.atomledger.core.atom;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Quark kind rules for particle variants.
 */
final class Quarks {
    private Quarks() {}

    /**
     * Checks that {@code quarks} holds exactly one of each required kind, at most one of each
     * optional kind, and nothing else.
     *
     * @return an immutable copy of {@code quarks}
     * @throws IllegalArgumentException if the rule is broken
     */
    static List<Quark> check(String particle, List<Quark> quarks,
                             Set<Class<? extends Quark>> required, Set<Class<? extends Quark>> optional) {
        Objects.requireNonNull(quarks, "quarks");
        List<Quark> copy = List.copyOf(quarks);
        Set<Class<?>> seen = new HashSet<>();
        for (Quark quark : copy) {
            Class<?> kind = quark.getClass();
            if (!required.contains(kind) && !optional.contains(kind)) {
                throw new IllegalArgumentException(particle + " does not accept " + kind.getSimpleName());
            }
            if (!seen.add(kind)) {
                throw new IllegalArgumentException(particle + " holds more than one " + kind.getSimpleName());
            }
        }
        for (Class<? extends Quark> kind : required) {
            if (!seen.contains(kind)) {
                throw new IllegalArgumentException(particle + " requires " + kind.getSimpleName());
            }
        }
        return copy;
    }
}
