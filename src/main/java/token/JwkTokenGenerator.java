package token;

import config.JwtConfig;
import error.ErrorType;
import error.JwtException;
import jwk.Jwk;
import jwt.Jwt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import token.interfaces.TokenGenerator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues RS256 tokens with a private JWK.
 * Every token carries {@code iss, sub, aud, iat, exp}; custom claims follow and may override them.
 */
public class JwkTokenGenerator implements TokenGenerator {
    private static final Logger log = LoggerFactory.getLogger(JwkTokenGenerator.class);

    private final Jwk signingKey;
    private final String issuer;
    private final String audience;
    private final long lifetimeSec;

    /**
     * @param signingKey  A private key.
     * @param issuer      The {@code iss} claim, or null to leave it out.
     * @param audience    The {@code aud} claim, or null to leave it out.
     * @param lifetimeSec Seconds between {@code iat} and {@code exp}.
     */
    public JwkTokenGenerator(Jwk signingKey, String issuer, String audience, long lifetimeSec) {
        if (!signingKey.isPrivate()) {
            throw new IllegalArgumentException("Signing key must be a private key.");
        }
        if (lifetimeSec <= 0) {
            throw new IllegalArgumentException("Token lifetime must be positive.");
        }
        this.signingKey = signingKey;
        this.issuer = issuer;
        this.audience = audience;
        this.lifetimeSec = lifetimeSec;
    }

    public JwkTokenGenerator(Jwk signingKey, String issuer, String audience) {
        this(signingKey, issuer, audience, JwtConfig.DEFAULT_TOKEN_LIFETIME_SEC);
    }

    @Override
    public String generateToken(String subject, long startTimeSec, Map<String, Object> info) throws JwtException {
        if (subject == null) {
            throw new JwtException(ErrorType.Payload, "Missing subject");
        }
        // 1. Registered claims
        Map<String, Object> claims = new LinkedHashMap<>();
        if (issuer != null) {
            claims.put("iss", issuer);
        }
        claims.put("sub", subject);
        if (audience != null) {
            claims.put("aud", audience);
        }
        claims.put("iat", startTimeSec);
        claims.put("exp", startTimeSec + lifetimeSec);

        // 2. Custom claims; a custom claim with a registered name replaces it
        if (info != null) {
            claims.putAll(info);
        }

        String token = Jwt.create(claims).sign(signingKey);
        log.debug("Issued token for subject {} with key {}", subject, signingKey.getKid());
        return token;
    }
}
