package keyset;

import error.ErrorType;
import error.JwtException;
import jwk.Jwk;
import keyset.interfaces.KeySet;
import keyset.interfaces.KeySetSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.JsonUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JSON Web Key Set as described in <a href="https://www.rfc-editor.org/rfc/rfc7517#section-5">RFC 7517 §5</a>.
 * The keys live in a single immutable list that {@link #refresh()} swaps atomically.
 * Members of a fetched set that are not usable RSA keys are skipped, so a set keeps serving the
 * keys it understands.
 */
public class JwkSet implements KeySet {
    private static final Logger log = LoggerFactory.getLogger(JwkSet.class);
    private static final String DECODE_FAILED = "Failed to decode key set";

    private final String url;
    private final KeySetSource source;
    private final AtomicReference<List<Jwk>> keys;

    /**
     * Creates a set that loads its keys from a URL. It is empty until the first {@link #refresh()}.
     *
     * @param url    Where the key set is published.
     * @param source Fetches the key set document.
     */
    public JwkSet(String url, KeySetSource source) {
        this.url = Objects.requireNonNull(url, "url");
        this.source = Objects.requireNonNull(source, "source");
        this.keys = new AtomicReference<>(List.of());
    }

    private JwkSet(List<Jwk> keys) {
        this.url = null;
        this.source = null;
        this.keys = new AtomicReference<>(List.copyOf(keys));
    }

    /**
     * Creates a fixed set. Refreshing it does nothing.
     */
    public static JwkSet of(List<Jwk> keys) {
        return new JwkSet(keys);
    }

    /**
     * Parses a fixed set from its JSON document {@code {"keys": [...]}}.
     *
     * @throws JwtException Invalid if the document is not a key set.
     */
    public static JwkSet parse(String json) throws JwtException {
        return new JwkSet(parseKeys(json));
    }

    static List<Jwk> parseKeys(String json) throws JwtException {
        Map<String, Object> document = JsonUtil.parseObject(json, DECODE_FAILED);
        if (!(document.get("keys") instanceof List<?> members)) {
            throw new JwtException(ErrorType.Invalid, DECODE_FAILED);
        }
        List<Jwk> parsed = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            Object member = members.get(i);
            if (!(member instanceof Map)) {
                log.warn("Skipping key #{} of key set: not a JSON object", i);
                continue;
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> jwkMembers = (Map<String, Object>) member;
                parsed.add(Jwk.fromMembers(jwkMembers));
            } catch (JwtException e) {
                log.warn("Skipping key #{} of key set: {}", i, e.toString());
            }
        }
        return parsed;
    }

    @Override
    public Jwk select(String kid) throws JwtException {
        List<Jwk> current = keys.get();
        if (kid == null) {
            // a token without kid can only be matched by an unambiguous set
            if (current.size() == 1) {
                return current.get(0);
            }
        } else {
            for (Jwk jwk : current) {
                if (kid.equals(jwk.getKid())) {
                    return jwk;
                }
            }
        }
        throw new JwtException(ErrorType.Key, "No matching key");
    }

    @Override
    public void refresh() throws JwtException {
        if (source == null) {
            return;
        }
        String document;
        try {
            document = source.fetch(url);
        } catch (IOException e) {
            log.warn("Failed to fetch key set from {}", url, e);
            throw new JwtException(ErrorType.Connection, "Failed to fetch key set");
        }
        List<Jwk> refreshed = List.copyOf(parseKeys(document));
        keys.set(refreshed);
        log.info("Loaded {} key(s) from {}", refreshed.size(), url);
    }

    public String getUrl() {
        return url;
    }

    public List<Jwk> getKeys() {
        return keys.get();
    }

    /**
     * Serializes the set, private members included.
     */
    public String toJson() {
        return write(false);
    }

    /**
     * Serializes the public projection of every key, as published on a JWKS endpoint.
     */
    public String toPublicJson() {
        return write(true);
    }

    private String write(boolean publicOnly) {
        List<Object> members = new ArrayList<>();
        for (Jwk jwk : keys.get()) {
            members.add((publicOnly ? jwk.toPublic() : jwk).toMembers());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("keys", members);
        try {
            return JsonUtil.toJson(document, "Failed to encode key set");
        } catch (JwtException e) {
            // members are produced by Jwk and always representable
            throw new IllegalStateException(e.toString());
        }
    }
}
