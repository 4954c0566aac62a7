package error;

/**
 * Type of error encountered while handling keys and tokens.
 */
public enum ErrorType {
    /** Token or key is malformed. */
    Invalid,
    /** Token has expired. */
    Expired,
    /** Not Before (nbf) is set and it's too early to use the token. */
    Early,
    /** Signature does not verify against the key. */
    Certificate,
    /** No usable key. */
    Key,
    /** Could not download the key set. */
    Connection,
    /** Problem with JWT header. */
    Header,
    /** Problem with JWT payload. */
    Payload,
    /** Problem with JWT signature. */
    Signature,
    /** Internal problem (signals a serious bug or fatal error). */
    Internal
}
