package io.atomledger.core.atom;

import java.util.Objects;

/**
 * Timestamps a particle under a named time key.
 */
public record ChronoQuark(String timeKey, long timestamp) implements Quark {
    public ChronoQuark {
        Objects.requireNonNull(timeKey, "timeKey");
    }
}
