package validation;

import config.JwtConfig;
import error.ErrorType;
import error.JwtException;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Checks the registered claims of a payload whose signature has already been verified.
 * Times are NumericDate values (seconds since the epoch); {@code leewaySec} absorbs clock skew
 * between issuer and verifier.
 */
public class ClaimsValidator {
    private final Clock clock;
    private final long leewaySec;
    private final String issuer;
    private final String audience;

    /**
     * @param clock     Source of the current time.
     * @param leewaySec Tolerated clock skew in seconds.
     * @param issuer    Required {@code iss}, or null to accept any.
     * @param audience  Required member of {@code aud}, or null to accept any.
     */
    public ClaimsValidator(Clock clock, long leewaySec, String issuer, String audience) {
        if (leewaySec < 0) {
            throw new IllegalArgumentException("Leeway must not be negative.");
        }
        this.clock = clock;
        this.leewaySec = leewaySec;
        this.issuer = issuer;
        this.audience = audience;
    }

    /**
     * A validator that only checks the time claims, with the default leeway.
     */
    public static ClaimsValidator timeOnly() {
        return new ClaimsValidator(Clock.systemUTC(), JwtConfig.DEFAULT_CLOCK_SKEW_SEC, null, null);
    }

    /**
     * @param claims The payload members.
     * @throws JwtException Expired, Early, or Payload for a malformed or mismatching claim.
     */
    public void validate(Map<String, ?> claims) throws JwtException {
        long now = clock.instant().getEpochSecond();

        Long exp = numericDate(claims, "exp");
        if (exp != null && now - leewaySec >= exp) {
            throw new JwtException(ErrorType.Expired, "Token has expired");
        }
        Long nbf = numericDate(claims, "nbf");
        if (nbf != null && now + leewaySec < nbf) {
            throw new JwtException(ErrorType.Early, "Token is not yet valid");
        }
        numericDate(claims, "iat");

        if (issuer != null && !issuer.equals(claims.get("iss"))) {
            throw new JwtException(ErrorType.Payload, "Issuer does not match");
        }
        if (audience != null && !hasAudience(claims.get("aud"))) {
            throw new JwtException(ErrorType.Payload, "Audience does not match");
        }
    }

    private boolean hasAudience(Object aud) {
        // RFC 7519 §4.1.3: a single string or an array of strings
        if (aud instanceof List<?> audiences) {
            return audiences.contains(audience);
        }
        return audience.equals(aud);
    }

    private static Long numericDate(Map<String, ?> claims, String name) throws JwtException {
        Object value = claims.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new JwtException(ErrorType.Payload, "Invalid time claim");
        }
        return ((Number) value).longValue();
    }
}
