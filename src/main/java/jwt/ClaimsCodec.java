package jwt;

import java.util.Map;

/**
 * Converts between a caller's claim type and the JSON members of a token payload.
 * The payload is written in the iteration order of the returned map.
 *
 * @param <T> The claim type.
 */
public interface ClaimsCodec<T> {

    /**
     * @param claims The caller's claims.
     * @return The payload members. Values must be strings, numbers, booleans, null, lists or maps.
     * @throws IllegalArgumentException if the claims cannot be represented.
     */
    Map<String, Object> toClaims(T claims);

    /**
     * @param claims The payload members as parsed: numbers arrive as {@link Long} or {@link Double},
     *               arrays as {@link java.util.List}, objects as {@link Map}.
     * @return The caller's claims.
     * @throws IllegalArgumentException or {@link ClassCastException} if the members do not fit the type.
     */
    T fromClaims(Map<String, Object> claims);
}
