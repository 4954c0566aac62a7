package jwt;

import config.JwtConfig;
import error.ErrorType;
import error.JwtException;
import jwk.Jwk;
import utils.Base64Url;
import utils.JsonUtil;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * JSON Web Token as described in <a href="https://tools.ietf.org/html/rfc7519">RFC 7519</a>.
 * A token is either parsed from its compact form through {@link #from(String)}, or created around a
 * payload and turned into a compact string with {@link #sign(Jwk)}. Instances are immutable.
 *
 * @param <T> The claim type of the payload.
 */
public final class Jwt<T> {
    private static final String ENCODE_FAILED = "Failed to encode segment";

    private final Header header;
    private final T payload;
    private final String signature;
    private final ClaimsCodec<T> codec;

    Jwt(Header header, T payload, String signature, ClaimsCodec<T> codec) {
        this.header = header;
        this.payload = payload;
        this.signature = signature;
        this.codec = codec;
    }

    /**
     * Creates an unsigned token around a map payload.
     */
    public static Jwt<Map<String, Object>> create(Map<String, Object> payload) {
        return create(payload, MapClaimsCodec.INSTANCE);
    }

    /**
     * Creates an unsigned token. Its header is {@link Header#EMPTY} and its signature is empty.
     *
     * @param payload The claims.
     * @param codec   Converts the claims to payload members.
     */
    public static <T> Jwt<T> create(T payload, ClaimsCodec<T> codec) {
        return new Jwt<>(Header.EMPTY, Objects.requireNonNull(payload, "payload"), "",
                Objects.requireNonNull(codec, "codec"));
    }

    /**
     * Starts parsing a compact token.
     */
    public static Parser from(String token) {
        return new Parser(token, null);
    }

    /**
     * Signs the payload of this token with RS256.
     * The header carries {@code alg} RS256 (the only algorithm a parsed key admits), type {@code JWT}
     * and the key's {@code kid} when it has one.
     *
     * @param jwk A private key.
     * @return The compact serialization {@code header.payload.signature}.
     * @throws JwtException Invalid if the key cannot sign or a segment cannot be encoded,
     *                      Internal if the RSA primitive fails.
     */
    public String sign(Jwk jwk) throws JwtException {
        // 1. Build the header from the key
        Header signingHeader = new Header(jwk.alg(), JwtConfig.TOKEN_TYPE, jwk.getKid(), null, null);

        // 2. Serialize and Base64Url-encode header and payload
        String base64UrlHeader = Base64Url.encode(JsonUtil.toJson(signingHeader.toMembers(), ENCODE_FAILED));
        String base64UrlPayload = Base64Url.encode(JsonUtil.toJson(encodeClaims(), ENCODE_FAILED));

        // 3. Define the content that needs to be signed
        String contentToSign = base64UrlHeader + JwtConfig.SEGMENT_SEPARATOR + base64UrlPayload;

        // 4. Sign it and append the Base64Url-encoded signature
        byte[] signatureBytes = jwk.sign(contentToSign.getBytes(StandardCharsets.US_ASCII));
        return contentToSign + JwtConfig.SEGMENT_SEPARATOR + Base64Url.encode(signatureBytes);
    }

    private Map<String, Object> encodeClaims() throws JwtException {
        try {
            return codec.toClaims(payload);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new JwtException(ErrorType.Invalid, ENCODE_FAILED);
        }
    }

    public Header getHeader() {
        return header;
    }

    public T getPayload() {
        return payload;
    }

    /**
     * Returns the signature segment as found in the token, still base64url-encoded.
     */
    public String getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return String.format("[header=%s, payload=%s, signature=%s]", header, payload, signature);
    }
}
