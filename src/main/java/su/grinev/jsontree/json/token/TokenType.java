package su.grinev.jsontree.json.token;

public enum TokenType {
    CURLY_OPEN,
    CURLY_CLOSE,
    SQUARE_OPEN,
    SQUARE_CLOSE,
    STRING,
    NUMBER,
    COMMA,
    COLON,
    BOOLEAN,
    NULL
}
