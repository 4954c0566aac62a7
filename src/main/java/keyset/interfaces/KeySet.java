package keyset.interfaces;

import error.JwtException;
import jwk.Jwk;

/**
 * A named collection of keys, selected by key id.
 * Refreshing replaces the whole collection at once; a concurrent {@link #select(String)} sees either
 * the old keys or the new ones.
 */
public interface KeySet {

    /**
     * Selects the key for a token.
     *
     * @param kid The key id from the token header, or null when the header has none.
     * @return The matching key.
     * @throws JwtException Key if no key matches.
     */
    Jwk select(String kid) throws JwtException;

    /**
     * Reloads the keys from their origin.
     *
     * @throws JwtException Connection if the keys could not be fetched, Invalid if the fetched
     *                      document is not a key set.
     */
    void refresh() throws JwtException;
}
