package jwt;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed claims used by the codec tests.
 */
final class Claims {
    static final ClaimsCodec<Claims> CODEC = new ClaimsCodec<>() {
        @Override
        public Map<String, Object> toClaims(Claims claims) {
            Map<String, Object> members = new LinkedHashMap<>();
            members.put("sub", claims.sub);
            members.put("name", claims.name);
            members.put("iat", claims.iat);
            return members;
        }

        @Override
        public Claims fromClaims(Map<String, Object> claims) {
            return new Claims((String) claims.get("sub"), (String) claims.get("name"),
                    ((Number) claims.get("iat")).longValue());
        }
    };

    final String sub;
    final String name;
    final long iat;

    Claims(String sub, String name, long iat) {
        this.sub = sub;
        this.name = name;
        this.iat = iat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Claims claims = (Claims) o;
        return iat == claims.iat && Objects.equals(sub, claims.sub) && Objects.equals(name, claims.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sub, name, iat);
    }

    @Override
    public String toString() {
        return "Claims{sub=" + sub + ", name=" + name + ", iat=" + iat + "}";
    }
}
