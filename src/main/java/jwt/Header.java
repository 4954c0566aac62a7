package jwt;

import error.ErrorType;
import error.JwtException;
import utils.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JOSE header of a token. Unknown members are ignored on decode; absent members are omitted on encode.
 */
public final class Header {
    /** Header of a token that has not been signed yet. */
    public static final Header EMPTY = new Header(null, null, null, null, null);

    private static final String DECODE_FAILED = "Failed to decode header";

    private final String alg;
    private final String typ;
    private final String kid;
    private final String enc;
    private final String cty;

    public Header(String alg, String typ, String kid, String enc, String cty) {
        this.alg = alg;
        this.typ = typ;
        this.kid = kid;
        this.enc = enc;
        this.cty = cty;
    }

    static Header fromMembers(Map<String, Object> members) throws JwtException {
        String alg = JsonUtil.optionalString(members, "alg", DECODE_FAILED);
        if (alg == null) {
            throw new JwtException(ErrorType.Invalid, DECODE_FAILED);
        }
        return new Header(alg,
                JsonUtil.optionalString(members, "typ", DECODE_FAILED),
                JsonUtil.optionalString(members, "kid", DECODE_FAILED),
                JsonUtil.optionalString(members, "enc", DECODE_FAILED),
                JsonUtil.optionalString(members, "cty", DECODE_FAILED));
    }

    Map<String, Object> toMembers() {
        Map<String, Object> members = new LinkedHashMap<>();
        putIfPresent(members, "alg", alg);
        putIfPresent(members, "typ", typ);
        putIfPresent(members, "kid", kid);
        putIfPresent(members, "enc", enc);
        putIfPresent(members, "cty", cty);
        return members;
    }

    private static void putIfPresent(Map<String, Object> members, String name, String value) {
        if (value != null) {
            members.put(name, value);
        }
    }

    public String getAlg() {
        return alg;
    }

    public String getTyp() {
        return typ;
    }

    public String getKid() {
        return kid;
    }

    public String getEnc() {
        return enc;
    }

    public String getCty() {
        return cty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Header header = (Header) o;
        return Objects.equals(alg, header.alg)
                && Objects.equals(typ, header.typ)
                && Objects.equals(kid, header.kid)
                && Objects.equals(enc, header.enc)
                && Objects.equals(cty, header.cty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alg, typ, kid, enc, cty);
    }

    @Override
    public String toString() {
        return toMembers().toString();
    }
}
