package jwk;

import config.JwtConfig;
import error.ErrorType;
import error.JwtException;
import jwk.interfaces.Signer;
import jwk.interfaces.Verifier;
import utils.Base64Url;
import utils.JsonUtil;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON Web Key as described in <a href="https://www.rfc-editor.org/rfc/rfc7517">RFC 7517</a>.
 * A parsed key is immutable and can be shared between threads.
 * Only RSA keys are supported; the body is either {@link RsaPublic} or {@link RsaPrivate}
 * depending on whether the private exponent {@code d} is present.
 */
public final class Jwk {
    private static final String DECODE_FAILED = "Failed to decode key";

    private final String kty;
    private final String kid;
    private final String alg;
    private final List<String> keyOps;
    private final String x5u;
    private final List<String> x5c;
    private final String x5t;
    private final String x5tS256;
    private final Verifier key;

    private Jwk(String kty, String kid, String alg, List<String> keyOps, String x5u, List<String> x5c,
                String x5t, String x5tS256, Verifier key) {
        this.kty = kty;
        this.kid = kid;
        this.alg = alg;
        this.keyOps = keyOps;
        this.x5u = x5u;
        this.x5c = x5c;
        this.x5t = x5t;
        this.x5tS256 = x5tS256;
        this.key = key;
    }

    /**
     * Parses a single JWK JSON object.
     *
     * @param json The JWK JSON text.
     * @return The parsed key.
     * @throws JwtException Invalid if the text is not a well-formed RSA JWK.
     */
    public static Jwk parse(String json) throws JwtException {
        return fromMembers(JsonUtil.parseObject(json, DECODE_FAILED));
    }

    /**
     * Builds a key from already parsed JSON members, as found inside a key set.
     * Unknown members are ignored.
     *
     * @param members The members of the JWK object.
     * @return The parsed key.
     * @throws JwtException Invalid if a mandatory member is missing or malformed, or if the declared
     *                      {@code alg} is not RS256.
     */
    public static Jwk fromMembers(Map<String, Object> members) throws JwtException {
        // 1. Metadata common to all key types
        if (!members.containsKey("kty")) {
            throw new JwtException(ErrorType.Invalid, "Missing key type");
        }
        String kty = JsonUtil.optionalString(members, "kty", DECODE_FAILED);
        if (!JwtConfig.KEY_TYPE_RSA.equals(kty)) {
            throw new JwtException(ErrorType.Invalid, "Unsupported key type");
        }
        String kid = JsonUtil.optionalString(members, "kid", DECODE_FAILED);
        String alg = JsonUtil.optionalString(members, "alg", DECODE_FAILED);
        if (alg != null && !JwtConfig.ALGORITHM_RS256.equals(alg)) {
            throw new JwtException(ErrorType.Invalid, "Unsupported algorithm");
        }
        List<String> keyOps = stringList(members.get("key_ops"));
        String x5u = JsonUtil.optionalString(members, "x5u", DECODE_FAILED);
        List<String> x5c = stringList(members.get("x5c"));
        String x5t = JsonUtil.optionalString(members, "x5t", DECODE_FAILED);
        String x5tS256 = JsonUtil.optionalString(members, "x5t#S256", DECODE_FAILED);

        // 2. Key body, discriminated by the private exponent
        RsaPublic publicKey = new RsaPublic(requiredMember(members, "n"), requiredMember(members, "e"));
        String d = JsonUtil.optionalString(members, "d", DECODE_FAILED);
        Verifier body;
        if (d != null && !d.isEmpty()) {
            body = new RsaPrivate(publicKey, d,
                    requiredMember(members, "p"),
                    requiredMember(members, "q"),
                    JsonUtil.optionalString(members, "dp", DECODE_FAILED),
                    JsonUtil.optionalString(members, "dq", DECODE_FAILED),
                    JsonUtil.optionalString(members, "qi", DECODE_FAILED));
        } else {
            body = publicKey;
        }
        return new Jwk(kty, kid, alg, keyOps, x5u, x5c, x5t, x5tS256, body);
    }

    /**
     * Returns the algorithm of this key. Parsing only admits RS256, declared or implied by the key type.
     */
    public String alg() {
        return alg != null ? alg : JwtConfig.ALGORITHM_RS256;
    }

    /**
     * Verifies an RS256 signature with the public part of this key.
     *
     * @param message   The signed bytes.
     * @param signature The raw signature bytes.
     * @throws JwtException Certificate if the signature does not match, whatever the reason.
     */
    public void verify(byte[] message, byte[] signature) throws JwtException {
        key.verify(message, signature);
    }

    /**
     * Signs a message with RS256.
     *
     * @param message The bytes to sign.
     * @return The raw signature bytes, as long as the modulus.
     * @throws JwtException Invalid for a public key, Internal if the RSA primitive fails.
     */
    public byte[] sign(byte[] message) throws JwtException {
        if (key instanceof Signer signer) {
            return signer.sign(message);
        }
        throw new JwtException(ErrorType.Invalid, "Key doesn't support signing");
    }

    public boolean isPrivate() {
        return key instanceof Signer;
    }

    /**
     * Returns the public projection of this key. Metadata is kept, private members are dropped.
     */
    public Jwk toPublic() {
        if (key instanceof RsaPrivate privateKey) {
            return new Jwk(kty, kid, alg, keyOps, x5u, x5c, x5t, x5tS256, privateKey.getPublicKey());
        }
        return this;
    }

    /**
     * Returns the members of this key in their JWK order, absent members omitted.
     */
    public Map<String, Object> toMembers() {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put("kty", kty);
        putIfPresent(members, "kid", kid);
        putIfPresent(members, "alg", alg);
        putIfPresent(members, "key_ops", keyOps);
        putIfPresent(members, "x5u", x5u);
        putIfPresent(members, "x5c", x5c);
        putIfPresent(members, "x5t", x5t);
        putIfPresent(members, "x5t#S256", x5tS256);
        if (key instanceof RsaPrivate privateKey) {
            privateKey.writeMembers(members);
        } else {
            ((RsaPublic) key).writeMembers(members);
        }
        return members;
    }

    /**
     * Serializes this key back to JWK JSON.
     */
    public String toJson() {
        try {
            return JsonUtil.toJson(toMembers(), "Failed to encode key");
        } catch (JwtException e) {
            // every member is a string or a list of strings
            throw new IllegalStateException(e.toString());
        }
    }

    public String getKty() {
        return kty;
    }

    public String getKid() {
        return kid;
    }

    public String getAlg() {
        return alg;
    }

    public List<String> getKeyOps() {
        return keyOps;
    }

    public String getX5u() {
        return x5u;
    }

    public List<String> getX5c() {
        return x5c;
    }

    public String getX5t() {
        return x5t;
    }

    public String getX5tS256() {
        return x5tS256;
    }

    static BigInteger decodeMember(String encoded) throws JwtException {
        try {
            return Base64Url.decodeUnsigned(encoded);
        } catch (JwtException e) {
            throw new JwtException(ErrorType.Invalid, DECODE_FAILED);
        }
    }

    private static String requiredMember(Map<String, Object> members, String name) throws JwtException {
        String value = JsonUtil.optionalString(members, name, DECODE_FAILED);
        if (value == null || value.isEmpty()) {
            throw new JwtException(ErrorType.Invalid, "Missing key member");
        }
        return value;
    }

    private static List<String> stringList(Object value) throws JwtException {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (!(value instanceof List<?> list)) {
            throw new JwtException(ErrorType.Invalid, DECODE_FAILED);
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String)) {
                throw new JwtException(ErrorType.Invalid, DECODE_FAILED);
            }
            strings.add((String) item);
        }
        return Collections.unmodifiableList(strings);
    }

    private static void putIfPresent(Map<String, Object> members, String name, Object value) {
        if (value != null) {
            members.put(name, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Jwk jwk = (Jwk) o;
        return kty.equals(jwk.kty)
                && Objects.equals(kid, jwk.kid)
                && Objects.equals(alg, jwk.alg)
                && Objects.equals(keyOps, jwk.keyOps)
                && Objects.equals(x5u, jwk.x5u)
                && Objects.equals(x5c, jwk.x5c)
                && Objects.equals(x5t, jwk.x5t)
                && Objects.equals(x5tS256, jwk.x5tS256)
                && key.equals(jwk.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kty, kid, alg, keyOps, x5u, x5c, x5t, x5tS256, key);
    }

    @Override
    public String toString() {
        // no private members
        return String.format("[kty=%s, kid=%s, alg=%s, private=%s]", kty, kid, alg(), isPrivate());
    }
}
