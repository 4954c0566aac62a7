package jwt;

import config.JwtConfig;
import error.ErrorType;
import error.JwtException;
import jwk.Jwk;
import utils.Base64Url;
import utils.JsonUtil;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the compact serialization of a token, optionally checking its signature.
 * <pre>
 *     Jwt.from(token).withVerificationKey(jwk).parse(codec)
 * </pre>
 * A parser is immutable; {@link #withVerificationKey(Jwk)} returns a new one, and the last key set wins.
 */
public final class Parser {
    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(JwtConfig.SEGMENT_SEPARATOR));

    private final String token;
    private final Jwk verificationKey;

    Parser(String token, Jwk verificationKey) {
        this.token = token;
        this.verificationKey = verificationKey;
    }

    /**
     * @param jwk The key to verify the signature with, or null to skip verification.
     */
    public Parser withVerificationKey(Jwk jwk) {
        return new Parser(token, jwk);
    }

    /**
     * Parses the token into map claims.
     *
     * @see #parse(ClaimsCodec)
     */
    public Jwt<Map<String, Object>> parse() throws JwtException {
        return parse(MapClaimsCodec.INSTANCE);
    }

    /**
     * Parses the token.
     * When a verification key is set, the signature is checked over the header and payload segments
     * exactly as they appear in the token.
     *
     * @param codec Converts the payload members to the caller's claim type.
     * @return The parsed token.
     * @throws JwtException Invalid for a malformed token, Header for an algorithm the key must not
     *                      accept, Certificate if the signature does not match.
     */
    public <T> Jwt<T> parse(ClaimsCodec<T> codec) throws JwtException {
        // 1. Split into header, payload and signature; trailing empty segments count
        String[] segments = token == null ? new String[0] : SEPARATOR.split(token, -1);
        if (segments.length != JwtConfig.SEGMENT_COUNT) {
            throw new JwtException(ErrorType.Invalid, "JWT does not have 3 segments");
        }
        String headerSegment = segments[0];
        String payloadSegment = segments[1];
        String signatureSegment = segments[2];

        // 2. Decode header and payload
        Header header = Header.fromMembers(decodeSegment(headerSegment, "Failed to decode header"));
        T payload = decodePayload(payloadSegment, codec);

        // 3. Check the signature against the original segment bytes
        if (verificationKey != null) {
            checkAlgorithm(header.getAlg());
            byte[] signatureBytes;
            try {
                signatureBytes = Base64Url.decode(signatureSegment);
            } catch (JwtException e) {
                throw new JwtException(ErrorType.Invalid, "Failed to decode signature");
            }
            String signingInput = headerSegment + JwtConfig.SEGMENT_SEPARATOR + payloadSegment;
            verificationKey.verify(signingInput.getBytes(StandardCharsets.US_ASCII), signatureBytes);
        }
        return new Jwt<>(header, payload, signatureSegment, codec);
    }

    private void checkAlgorithm(String alg) throws JwtException {
        if (JwtConfig.ALGORITHM_NONE.equalsIgnoreCase(alg)) {
            throw new JwtException(ErrorType.Header, "Algorithm none is not allowed");
        }
        if (!verificationKey.alg().equals(alg)) {
            throw new JwtException(ErrorType.Header, "Algorithm does not match key");
        }
    }

    private static <T> T decodePayload(String segment, ClaimsCodec<T> codec) throws JwtException {
        Map<String, Object> members = decodeSegment(segment, "Failed to decode payload");
        try {
            return codec.fromClaims(members);
        } catch (IllegalArgumentException | ClassCastException | NullPointerException e) {
            throw new JwtException(ErrorType.Invalid, "Failed to decode payload");
        }
    }

    private static Map<String, Object> decodeSegment(String segment, String failureMsg) throws JwtException {
        byte[] raw;
        try {
            raw = Base64Url.decode(segment);
        } catch (JwtException e) {
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        return JsonUtil.parseObject(new String(raw, StandardCharsets.UTF_8), failureMsg);
    }
}
