package utils;

import error.JwtException;
import jwk.Jwk;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Map;

/**
 * Keys and tokens shared by the tests.
 */
public final class Fixtures {
    public static final String PRIVATE_KEY_FILE = "rs256_2048_private_key.json";
    public static final String PUBLIC_KEY_FILE = "rs256_2048_public_key.json";
    public static final String KEY_SET_FILE = "jwks.json";

    /** {"sub":"1234567890","name":"John Doe","iat":1516239022} */
    public static final String PAYLOAD_SEGMENT =
            "eyJzdWIiOiIxMjM0NTY3ODkwIiwibmFtZSI6IkpvaG4gRG9lIiwiaWF0IjoxNTE2MjM5MDIyfQ";

    /** HS256 sample token; its signature is never checked. */
    public static final String HS256_TOKEN = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9." + PAYLOAD_SEGMENT
            + ".SflKxwRJSMeKKF2QT4fwpMeJf36POk6yJV_adQssw5c";

    /** {"alg":"RS256","typ":"JWT","kid":"test"} signed with the fixture key. */
    public static final String RS256_TOKEN_WITH_KID = "eyJhbGciOiJSUzI1NiIsInR5cCI6IkpXVCIsImtpZCI6InRlc3QifQ."
            + PAYLOAD_SEGMENT + ".Rx9EFQ0QIdrb3YtcXQMFnJoFHpQKzGFMO9OJGOf8Xuc-rQEKuiRgPsy6UJ4iJbMQMGDUTGR_iIOZ6Bhn"
            + "D-UWxtBTU4MRbUADnXLOSTrM2G9Qe8ZqLU5otbqOQr6CBbolIj5Ah3bBGvR22Gev8N8CS4qvizcllzOTZ8VOL9ZZPvXtxzDj5pZUhnMNj"
            + "AQUO58hCDJhfj9t-n5EN5-oUOnU0gozPdkhJSir50o5Z7sI3V2XyJVAOaVPmXyIPnjTwdMHJhqOO865OF2Rf_EVipB28Uc5HZOmtSsOFyQ4"
            + "Ir6hksawCYVTHhIoUfIEIOfAbOCUaa1XqsCsxHOKvR2A98TcLA";

    /** {"alg":"RS256","typ":"JWT"} signed with the fixture key. */
    public static final String RS256_TOKEN = "eyJhbGciOiJSUzI1NiIsInR5cCI6IkpXVCJ9."
            + PAYLOAD_SEGMENT + ".fL2H3_Uv_slbg7IYotZJWvz87uAEZzI0dvJH6Fhyrg37l34InmC-KduOsKAU5DbDjNb8CpZvxRP7Kixc"
            + "LeUt6bJ1bd1h-3-oBgx9p8EVg7OtD8A4VJDhdetWXhgwY8eX1-wZQpmdLIbWpNy-7I1suuQ2HlbJyp_mV-Nluo0esbgUseoESLo3zYThSr"
            + "a7BP0e_kzp8ssaE7Qt3VFOEiPwmZyXozEB_lgUuKUch_yzoesqVbNp3SPmP9hffjCXddu0Z0GtNzwieqTrnTzjrl4g8vYyNOT_sRgWgvjr"
            + "zd6dMrhCqT1QmAzmJpNZf8zgQoR77DrDMUeBdTvuLPEmiSmh4A";

    /**
     * Same header and payload, but signed by padding the signing input itself instead of its
     * SHA-256 DigestInfo. Not a valid RS256 signature.
     */
    public static final String RAW_PKCS1_TOKEN = "eyJhbGciOiJSUzI1NiIsInR5cCI6IkpXVCJ9."
            + PAYLOAD_SEGMENT + ".YCSbIl71ucUlggqB4_6dErtfMq3n80LLKCbguSKp3iN8TZ_iRBW3Dw-75MlC8ooCFw7ketVxbPhkfvbGs"
            + "yZkIfM1LIg4iY7mlxtFkxZUrY5mT7ymJRNJDLXAOvHpYnOckjgmjOQcGbin_LECxkqywi7BrOemEYZl5hPEJ3Wsgk-Ca4LNqk2XXaHpT-T"
            + "iz4Qqc6UDagn83bZDQrHSedq-67HoWiOQNLipaG_7si4yRNOZKry3YFkulrE7K64sT92z_uEg4WOcZXtXtwhnrNdcnlw0eWle97N_L7pxY"
            + "F1DUraZvnxuiiYcqNfbub29op0-ZskCNhwM_1OLbC8axTdpTQ";

    /** RS256 signature of the ASCII message "1234567890" with the fixture key. */
    public static final String MESSAGE_SIGNATURE = "fFCTUZ6-y7iW7IdGPWD_9bTujZJ_Y1SXB6l4q_8Sb8RRaRzGbDwA-lpRobsp7kxd"
            + "iHQHLeDRB66Q9PmGativ3yRNP86abkpLML7RdA7ch2uBuMahgsAJgpJMxhoWD9F8a7-G9K-NsPAyI3WUWsgqqyawm6F74T52OwPlIbe"
            + "BKrp-EKYRBRfLI4XQqsdqv0t26OlG3l_2UdbYFN_w44LbdxCxWZGo7plUNQJR7PXgRX9yoUhjEwLIU8foAVdtYXKeN5JalWuwhmXF9wK"
            + "KDySbg3uAOSZfkZMfTuU2Cjbi55ibUnokI-NFqZ4o08ZZiUan8tXBw8yKUCxkYFB1aQuWsA";

    private Fixtures() {}

    public static String read(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Jwk privateKey() throws JwtException {
        return Jwk.parse(read(PRIVATE_KEY_FILE));
    }

    public static Jwk publicKey() throws JwtException {
        return Jwk.parse(read(PUBLIC_KEY_FILE));
    }

    /**
     * Builds the JCA public key of a JWK, for libraries that take one.
     */
    public static RSAPublicKey rsaPublicKey(Jwk jwk) throws JwtException, GeneralSecurityException {
        Map<String, Object> members = jwk.toMembers();
        return (RSAPublicKey) KeyFactory.getInstance("RSA")
                .generatePublic(new RSAPublicKeySpec(member(members, "n"), member(members, "e")));
    }

    /**
     * Builds the JCA private key of a private JWK carrying all CRT members.
     */
    public static RSAPrivateKey rsaPrivateKey(Jwk jwk) throws JwtException, GeneralSecurityException {
        Map<String, Object> members = jwk.toMembers();
        return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new RSAPrivateCrtKeySpec(
                member(members, "n"), member(members, "e"), member(members, "d"),
                member(members, "p"), member(members, "q"),
                member(members, "dp"), member(members, "dq"), member(members, "qi")));
    }

    private static BigInteger member(Map<String, Object> members, String name) throws JwtException {
        return Base64Url.decodeUnsigned((String) members.get(name));
    }
}
