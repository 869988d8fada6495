package su.grinev.jsontree.json.value;

public final class JsonNull implements JsonValue {

    public static final JsonNull INSTANCE = new JsonNull();

    private JsonNull() {
    }

    @Override
    public JsonValueType type() {
        return JsonValueType.NULL;
    }

    @Override
    public String toString() {
        return "JsonNull";
    }
}
