package keyset.interfaces;

import java.io.IOException;

/**
 * Fetches the JSON document of a key set, typically over HTTP.
 */
@FunctionalInterface
public interface KeySetSource {
    String fetch(String url) throws IOException;
}
