package jwt;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Claims held as a plain map, in insertion order.
 */
public final class MapClaimsCodec implements ClaimsCodec<Map<String, Object>> {
    public static final MapClaimsCodec INSTANCE = new MapClaimsCodec();

    private MapClaimsCodec() {}

    @Override
    public Map<String, Object> toClaims(Map<String, Object> claims) {
        return claims;
    }

    @Override
    public Map<String, Object> fromClaims(Map<String, Object> claims) {
        return new LinkedHashMap<>(claims);
    }
}
