package jwk.interfaces;

import error.JwtException;

/**
 * Produces a signature over a message with private key material.
 */
public interface Signer {

    /**
     * Signs a message.
     *
     * @param message The bytes to sign.
     * @return The raw signature bytes.
     * @throws JwtException Internal if the underlying primitive fails.
     */
    byte[] sign(byte[] message) throws JwtException;
}
