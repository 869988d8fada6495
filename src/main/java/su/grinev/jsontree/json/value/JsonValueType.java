package su.grinev.jsontree.json.value;

public enum JsonValueType {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT
}
