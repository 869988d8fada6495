package su.grinev.jsontree.json.value;

import java.util.Map;

/**
 * String-keyed members. Keys are unique and iteration order is unspecified.
 */
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        members = Map.copyOf(members);
    }

    public JsonValue get(String key) {
        return members.get(key);
    }

    public boolean containsKey(String key) {
        return members.containsKey(key);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Walks nested objects along a dot separated path, e.g. {@code "server.tls.port"}.
     *
     * @return the value at the end of the path, or {@code null} if a segment is missing
     * or an intermediate value is not an object
     */
    public JsonValue find(String path) {
        String[] segments = path.split("\\.", -1);

        JsonObject current = this;
        for (int i = 0; i < segments.length; i++) {
            JsonValue value = current.get(segments[i]);
            if (value == null || i == segments.length - 1) {
                return value;
            }
            if (!(value instanceof JsonObject nested)) {
                return null;
            }
            current = nested;
        }
        return null;
    }

    @Override
    public JsonValueType type() {
        return JsonValueType.OBJECT;
    }
}
