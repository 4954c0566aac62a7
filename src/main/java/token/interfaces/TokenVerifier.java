package token.interfaces;

import error.JwtException;
import jwt.Jwt;

import java.util.Map;

/**
 * An interface for verifying JSON Web Tokens.
 * Implementations decide where the verification key comes from and which claims are checked.
 */
public interface TokenVerifier {

    /**
     * Verifies a token.
     *
     * @param token The complete compact token.
     * @return The parsed token if its signature and claims are valid.
     * @throws JwtException If the token is malformed, the signature is invalid or a claim is rejected.
     */
    Jwt<Map<String, Object>> verify(String token) throws JwtException;
}
