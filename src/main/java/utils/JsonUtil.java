package utils;

import error.ErrorType;
import error.JwtException;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * JSON helpers shared by the key and token codecs.
 * Serialization writes members in the iteration order of the given map, so callers that need
 * byte-stable output pass a {@link java.util.LinkedHashMap}.
 */
public final class JsonUtil {
    private static final Logger log = LoggerFactory.getLogger(JsonUtil.class);

    private JsonUtil() {}

    /**
     * Parses a JSON text that must hold a single object.
     *
     * @param json       The JSON text.
     * @param failureMsg The message of the Invalid error raised on failure.
     * @return The parsed members.
     * @throws JwtException Invalid if the text is not a JSON object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json, String failureMsg) throws JwtException {
        if (json == null) {
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        Object parsed;
        try {
            // JSONParser keeps lexer state, so every call gets its own instance
            parsed = new JSONParser().parse(json);
        } catch (ParseException | RuntimeException e) {
            // json-simple reads every integer with Long.valueOf, so values beyond long end up here too
            log.debug("Rejected JSON text: {}", e.toString());
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        if (!(parsed instanceof JSONObject)) {
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        return (Map<String, Object>) parsed;
    }

    /**
     * Serializes an object without whitespace.
     *
     * @param members    The members, written in iteration order.
     * @param failureMsg The message of the Invalid error raised when a value has no JSON form.
     * @return The JSON text.
     * @throws JwtException Invalid if any nested value is not representable.
     */
    public static String toJson(Map<String, ?> members, String failureMsg) throws JwtException {
        if (members == null || !isRepresentable(members)) {
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        return JSONValue.toJSONString(members);
    }

    /**
     * Reads an optional string member.
     *
     * @throws JwtException Invalid if the member is present but not a string.
     */
    public static String optionalString(Map<String, Object> members, String name, String failureMsg)
            throws JwtException {
        Object value = members.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new JwtException(ErrorType.Invalid, failureMsg);
        }
        return (String) value;
    }

    // json-simple falls back to toString() for unknown types, which would emit invalid JSON
    private static boolean isRepresentable(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return true;
        }
        if (value instanceof Double) {
            return !((Double) value).isNaN() && !((Double) value).isInfinite();
        }
        if (value instanceof Float) {
            return !((Float) value).isNaN() && !((Float) value).isInfinite();
        }
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isRepresentable(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (!isRepresentable(item)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
