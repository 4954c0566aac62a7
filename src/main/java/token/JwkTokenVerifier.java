package token;

import error.JwtException;
import jwk.Jwk;
import jwt.Jwt;
import keyset.interfaces.KeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import token.interfaces.TokenVerifier;
import validation.ClaimsValidator;

import java.util.Map;

/**
 * Verifies RS256 tokens against a key set.
 * The key is chosen by the {@code kid} of the token header, the signature is checked with it,
 * and the claims are validated last.
 */
public class JwkTokenVerifier implements TokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwkTokenVerifier.class);

    private final KeySet keySet;
    private final ClaimsValidator claimsValidator;

    public JwkTokenVerifier(KeySet keySet, ClaimsValidator claimsValidator) {
        this.keySet = keySet;
        this.claimsValidator = claimsValidator;
    }

    @Override
    public Jwt<Map<String, Object>> verify(String token) throws JwtException {
        try {
            // 1. Read the header without trusting it, only to pick the key
            String kid = Jwt.from(token).parse().getHeader().getKid();
            Jwk key = keySet.select(kid);

            // 2. Check the signature with the selected key
            Jwt<Map<String, Object>> jwt = Jwt.from(token).withVerificationKey(key).parse();

            // 3. Check the claims
            claimsValidator.validate(jwt.getPayload());
            return jwt;
        } catch (JwtException e) {
            log.debug("JWT verification failed: {}", e.toString());
            throw e;
        }
    }
}
