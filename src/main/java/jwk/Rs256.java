package jwk;

import config.JwtConfig;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;

/**
 * RSASSA-PKCS1-v1_5 with SHA-256 over BouncyCastle.
 * The signature bytes are SHA-256 wrapped in its DigestInfo, padded with 00 01 FF..FF 00 to the
 * modulus length and raised to d (signing) or e (verification) mod n.
 */
final class Rs256 {
    // Passed explicitly so the JVM-wide provider list stays untouched
    private static final Provider PROVIDER = new BouncyCastleProvider();

    private Rs256() {}

    static PublicKey publicKey(BigInteger n, BigInteger e) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance(JwtConfig.KEY_TYPE_RSA, PROVIDER);
        return factory.generatePublic(new RSAPublicKeySpec(n, e));
    }

    static PrivateKey privateKey(BigInteger n, BigInteger e, BigInteger d, BigInteger p, BigInteger q,
                                 BigInteger dp, BigInteger dq, BigInteger qi) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance(JwtConfig.KEY_TYPE_RSA, PROVIDER);
        return factory.generatePrivate(new RSAPrivateCrtKeySpec(n, e, d, p, q, dp, dq, qi));
    }

    static byte[] sign(PrivateKey key, byte[] message) throws GeneralSecurityException {
        Signature rsaSign = Signature.getInstance(JwtConfig.SIGNATURE_ALGORITHM, PROVIDER);
        rsaSign.initSign(key);
        rsaSign.update(message);
        return rsaSign.sign();
    }

    static boolean verify(PublicKey key, byte[] message, byte[] signature) throws GeneralSecurityException {
        Signature rsaVerify = Signature.getInstance(JwtConfig.SIGNATURE_ALGORITHM, PROVIDER);
        rsaVerify.initVerify(key);
        rsaVerify.update(message);
        return rsaVerify.verify(signature);
    }
}
