package io.atomledger.core.atom;

import java.util.List;

/**
 * Lists the addresses a particle must be delivered to.
 */
public record AccountableQuark(List<String> addresses) implements Quark {
    public AccountableQuark {
        addresses = List.copyOf(addresses);
        if (addresses.isEmpty()) {
            throw new IllegalArgumentException("addresses must not be empty");
        }
    }

    public static AccountableQuark of(String... addresses) {
        return new AccountableQuark(List.of(addresses));
    }
}
