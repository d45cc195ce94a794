package io.atomledger.core.atom;

import java.util.Objects;

/**
 * Gives a particle a resource identifier of the form {@code /<address>/<kind>/<unique>}.
 */
public record IdentifiableQuark(String id) implements Quark {
    public IdentifiableQuark {
        Objects.requireNonNull(id, "id");
        if (!id.startsWith("/") || id.split("/", -1).length != 4) {
            throw new IllegalArgumentException("malformed resource identifier: " + id);
        }
    }

    public static IdentifiableQuark of(String address, String kind, String unique) {
        return new IdentifiableQuark("/" + address + "/" + kind + "/" + unique);
    }

    public String address() {
        return id.split("/", -1)[1];
    }

    public String unique() {
        return id.split("/", -1)[3];
    }
}
