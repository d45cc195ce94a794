package io.atomledger.core.atom;

import io.atomledger.core.UInt256;

import java.util.Objects;

/**
 * Makes a particle fungible: it can be cut up into pieces and put back together.
 *
 * @param amount the quantity, in the token's smallest unit
 * @param planck the logical time unit the quantity was created in
 * @param nonce makes otherwise identical quantities distinct
 * @param type whether the quantity was minted, transferred or burned
 */
public record FungibleQuark(UInt256 amount, long planck, long nonce, FungibleType type) implements Quark {
    public FungibleQuark {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(type, "type");
    }
}
