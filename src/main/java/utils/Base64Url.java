package utils;

import error.ErrorType;
import error.JwtException;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * URL-safe Base64 without padding (RFC 4648 §5), the encoding of every JOSE segment and key member.
 */
public final class Base64Url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64Url() {}

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    /**
     * Encodes the UTF-8 bytes of a string.
     */
    public static String encode(String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes an unpadded base64url string.
     *
     * @param encoded The encoded text.
     * @return The decoded bytes.
     * @throws JwtException Invalid if a character is outside the URL-safe alphabet (padding included),
     *                      the length is 1 more than a multiple of 4, or the unused trailing bits are not zero.
     */
    public static byte[] decode(String encoded) throws JwtException {
        if (encoded == null || encoded.length() % 4 == 1) {
            throw new JwtException(ErrorType.Invalid, "Failed to decode segment");
        }
        for (int i = 0; i < encoded.length(); i++) {
            if (!isAlphabet(encoded.charAt(i))) {
                throw new JwtException(ErrorType.Invalid, "Failed to decode segment");
            }
        }
        byte[] decoded;
        try {
            decoded = DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new JwtException(ErrorType.Invalid, "Failed to decode segment");
        }
        // The JDK decoder ignores the unused low bits of the last character; only the canonical form is accepted
        if (!encode(decoded).equals(encoded)) {
            throw new JwtException(ErrorType.Invalid, "Failed to decode segment");
        }
        return decoded;
    }

    /**
     * Encodes a non-negative integer as its minimal big-endian magnitude, as JWK members require.
     */
    public static String encodeUnsigned(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Value must not be negative.");
        }
        byte[] bytes = value.toByteArray();
        // toByteArray() prepends a sign byte when the top bit is set
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return encode(bytes);
    }

    /**
     * Decodes a big-endian unsigned integer. Leading zero bytes are accepted.
     */
    public static BigInteger decodeUnsigned(String encoded) throws JwtException {
        return new BigInteger(1, decode(encoded));
    }

    private static boolean isAlphabet(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_';
    }
}
