package su.grinev.jsontree.json.value;

import java.util.List;

/**
 * Elements keep their source order.
 */
public record JsonArray(List<JsonValue> values) implements JsonValue {

    public JsonArray {
        values = List.copyOf(values);
    }

    public JsonValue get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public JsonValueType type() {
        return JsonValueType.ARRAY;
    }
}
