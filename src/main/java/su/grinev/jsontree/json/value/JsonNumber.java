package su.grinev.jsontree.json.value;

/**
 * Integer and fractional source numbers both end up here, so integers above 2^53 lose precision.
 */
public record JsonNumber(double value) implements JsonValue {

    @Override
    public JsonValueType type() {
        return JsonValueType.NUMBER;
    }
}
