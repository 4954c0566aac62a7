package jwk.interfaces;

import error.JwtException;

/**
 * Checks a signature over a message with public key material.
 */
public interface Verifier {

    /**
     * Verifies a signature.
     *
     * @param message   The signed bytes.
     * @param signature The raw signature bytes.
     * @throws JwtException Certificate if the signature does not match.
     */
    void verify(byte[] message, byte[] signature) throws JwtException;
}
