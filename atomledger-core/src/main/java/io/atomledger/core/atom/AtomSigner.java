package io.atomledger.core.atom;

import io.atomledger.core.Bytes;
import io.atomledger.core.EUID;

/**
 * Produces signatures over an atom's canonical bytes.
 *
 * <p>Key material stays with the implementation; the library only sees the signer's identifier
 * and the resulting signature.
 */
public interface AtomSigner {

    /**
     * Identifier the signature is filed under in {@link Atom#signatures()}.
     */
    EUID id();

    Bytes sign(byte[] canonicalBytes);
}
