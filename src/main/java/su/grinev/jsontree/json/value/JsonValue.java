package su.grinev.jsontree.json.value;

/**
 * Node of a parsed JSON document. The tree owns all of its data and holds no reference
 * to the source text or to the tokens it was built from.
 *
 * <p>Use {@link #type()} to dispatch with a {@code switch}, or the {@code asX} accessors
 * when the expected shape is known.
 */
public sealed interface JsonValue permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    JsonValueType type();

    default boolean isNull() {
        return type() == JsonValueType.NULL;
    }

    default boolean asBoolean() {
        return cast(JsonBoolean.class, JsonValueType.BOOLEAN).value();
    }

    default double asNumber() {
        return cast(JsonNumber.class, JsonValueType.NUMBER).value();
    }

    default String asString() {
        return cast(JsonString.class, JsonValueType.STRING).value();
    }

    default JsonArray asArray() {
        return cast(JsonArray.class, JsonValueType.ARRAY);
    }

    default JsonObject asObject() {
        return cast(JsonObject.class, JsonValueType.OBJECT);
    }

    private <T extends JsonValue> T cast(Class<T> target, JsonValueType expected) {
        if (type() != expected) {
            throw new IllegalStateException("Expected %s but was %s".formatted(expected, type()));
        }
        return target.cast(this);
    }
}
