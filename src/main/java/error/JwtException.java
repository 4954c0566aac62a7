package error;

import java.util.Objects;

/**
 * The single failure surfaced by key and token operations.
 * It carries a type and a short developer-facing message, and never a cause:
 * the layer that maps a library exception logs it before throwing this.
 */
public class JwtException extends Exception {
    private final ErrorType type;
    private final String msg;

    public JwtException(ErrorType type, String msg) {
        super(type + ": " + msg);
        this.type = Objects.requireNonNull(type, "type");
        this.msg = Objects.requireNonNull(msg, "msg");
    }

    public ErrorType getType() {
        return type;
    }

    public String getMsg() {
        return msg;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JwtException that = (JwtException) o;
        return type == that.type && msg.equals(that.msg);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, msg);
    }

    @Override
    public String toString() {
        return type + ": " + msg;
    }
}
