package jwk;

import error.ErrorType;
import error.JwtException;
import jwk.interfaces.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Objects;

/**
 * Public RSA key body: modulus {@code n} and exponent {@code e}.
 * The member strings are kept as received; their integer values are decoded once.
 */
final class RsaPublic implements Verifier {
    private static final Logger log = LoggerFactory.getLogger(RsaPublic.class);

    private final String n;
    private final String e;
    private final BigInteger modulus;
    private final BigInteger publicExponent;

    RsaPublic(String n, String e) throws JwtException {
        this.n = n;
        this.e = e;
        this.modulus = Jwk.decodeMember(n);
        this.publicExponent = Jwk.decodeMember(e);
    }

    BigInteger getModulus() {
        return modulus;
    }

    BigInteger getPublicExponent() {
        return publicExponent;
    }

    @Override
    public void verify(byte[] message, byte[] signature) throws JwtException {
        boolean valid;
        try {
            valid = Rs256.verify(Rs256.publicKey(modulus, publicExponent), message, signature);
        } catch (GeneralSecurityException | RuntimeException ex) {
            log.debug("RSA verification rejected the signature: {}", ex.toString());
            valid = false;
        }
        if (!valid) {
            throw new JwtException(ErrorType.Certificate, "Signature does not match certificate");
        }
    }

    void writeMembers(Map<String, Object> members) {
        members.put("e", e);
        members.put("n", n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RsaPublic that = (RsaPublic) o;
        return n.equals(that.n) && e.equals(that.e);
    }

    @Override
    public int hashCode() {
        return Objects.hash(n, e);
    }
}
