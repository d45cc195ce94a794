package io.atomledger.core.atom;

/**
 * What a fungible quantity records: creation, movement or destruction of tokens.
 */
public enum FungibleType {
    MINT("minted"),
    TRANSFER("transferred"),
    BURN("burned");

    private final String value;

    FungibleType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Returns the type for a serialized value, or {@code null} if unknown.
     */
    public static FungibleType fromValue(String value) {
        for (FungibleType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
