package su.grinev.jsontree.json.value;

import java.util.Objects;

public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public JsonValueType type() {
        return JsonValueType.STRING;
    }
}
