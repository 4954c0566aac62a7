package jwk;

import error.ErrorType;
import error.JwtException;
import jwk.interfaces.Signer;
import jwk.interfaces.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Private RSA key body: the public pair plus {@code d}, the primes {@code p} and {@code q}
 * and the optional CRT helpers {@code dp}, {@code dq}, {@code qi}.
 * The numeric relations between the members are not checked here; a key that does not
 * satisfy them produces signatures that fail verification.
 */
final class RsaPrivate implements Verifier, Signer {
    private static final Logger log = LoggerFactory.getLogger(RsaPrivate.class);

    private final RsaPublic publicKey;
    private final String d;
    private final String p;
    private final String q;
    private final String dp;
    private final String dq;
    private final String qi;

    private final BigInteger privateExponent;
    private final BigInteger primeP;
    private final BigInteger primeQ;
    private final BigInteger primeExponentP;
    private final BigInteger primeExponentQ;
    private final BigInteger crtCoefficient;

    RsaPrivate(RsaPublic publicKey, String d, String p, String q, String dp, String dq, String qi)
            throws JwtException {
        this.publicKey = publicKey;
        this.d = d;
        this.p = p;
        this.q = q;
        this.dp = dp;
        this.dq = dq;
        this.qi = qi;

        this.privateExponent = Jwk.decodeMember(d);
        this.primeP = Jwk.decodeMember(p);
        this.primeQ = Jwk.decodeMember(q);

        // Missing CRT helpers are derived; they only speed up the private operation
        BigInteger pMinus1 = primeP.subtract(BigInteger.ONE);
        BigInteger qMinus1 = primeQ.subtract(BigInteger.ONE);
        this.primeExponentP = dp != null ? Jwk.decodeMember(dp) : derive(() -> privateExponent.mod(pMinus1));
        this.primeExponentQ = dq != null ? Jwk.decodeMember(dq) : derive(() -> privateExponent.mod(qMinus1));
        this.crtCoefficient = qi != null ? Jwk.decodeMember(qi) : derive(() -> primeQ.modInverse(primeP));
    }

    RsaPublic getPublicKey() {
        return publicKey;
    }

    @Override
    public void verify(byte[] message, byte[] signature) throws JwtException {
        publicKey.verify(message, signature);
    }

    @Override
    public byte[] sign(byte[] message) throws JwtException {
        try {
            return Rs256.sign(Rs256.privateKey(publicKey.getModulus(), publicKey.getPublicExponent(),
                    privateExponent, primeP, primeQ, primeExponentP, primeExponentQ, crtCoefficient), message);
        } catch (GeneralSecurityException | IllegalArgumentException | IllegalStateException ex) {
            log.error("RSA signing failed", ex);
            throw new JwtException(ErrorType.Internal, "Sign message");
        }
    }

    void writeMembers(Map<String, Object> members) {
        publicKey.writeMembers(members);
        members.put("d", d);
        members.put("p", p);
        members.put("q", q);
        if (dp != null) {
            members.put("dp", dp);
        }
        if (dq != null) {
            members.put("dq", dq);
        }
        if (qi != null) {
            members.put("qi", qi);
        }
    }

    private static BigInteger derive(Supplier<BigInteger> derivation) throws JwtException {
        try {
            return derivation.get();
        } catch (ArithmeticException ex) {
            // p or q of zero or one, or q not invertible mod p
            throw new JwtException(ErrorType.Invalid, "Failed to decode key");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RsaPrivate that = (RsaPrivate) o;
        return publicKey.equals(that.publicKey)
                && d.equals(that.d)
                && p.equals(that.p)
                && q.equals(that.q)
                && Objects.equals(dp, that.dp)
                && Objects.equals(dq, that.dq)
                && Objects.equals(qi, that.qi);
    }

    @Override
    public int hashCode() {
        return Objects.hash(publicKey, d, p, q, dp, dq, qi);
    }
}
