package config;

/**
 * Centralized token configuration.
 * Values that callers may override are passed to the generator and validator constructors;
 * these are the defaults and the fixed protocol names.
 */
public final class JwtConfig {
    private JwtConfig() {}

    // Protocol names
    public static final String ALGORITHM_RS256 = "RS256";
    public static final String ALGORITHM_NONE = "none";
    public static final String SIGNATURE_ALGORITHM = "SHA256withRSA"; // JCA name for RS256
    public static final String KEY_TYPE_RSA = "RSA";
    public static final String TOKEN_TYPE = "JWT";

    // Compact serialization
    public static final String SEGMENT_SEPARATOR = ".";
    public static final int SEGMENT_COUNT = 3;

    // Lifetimes (seconds)
    public static final long DEFAULT_TOKEN_LIFETIME_SEC = 3600; // 1 hour
    public static final long DEFAULT_CLOCK_SKEW_SEC = 60;
}
