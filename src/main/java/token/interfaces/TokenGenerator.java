package token.interfaces;

import error.JwtException;

import java.util.Map;

/**
 * Generic interface for producing access tokens.
 */
public interface TokenGenerator {

    /**
     * Generates a signed token.
     *
     * @param subject      The {@code sub} claim.
     * @param startTimeSec Issue time in seconds since the epoch.
     * @param info         Custom claims, added after the registered ones. May be null.
     * @return The compact token.
     * @throws JwtException If the token cannot be encoded or signed.
     */
    String generateToken(String subject, long startTimeSec, Map<String, Object> info) throws JwtException;
}
