package su.grinev.jsontree.exception;

public enum JsonErrorKind {
    INVALID_ESCAPE("Invalid escape sequence"),
    UNTERMINATED_STRING("Unterminated string"),
    INVALID_NUMBER("Invalid number"),
    UNEXPECTED_CHARACTER("Unexpected character"),
    INVALID_LITERAL("Invalid literal"),
    UNEXPECTED_END_OF_INPUT("Unexpected end of input"),
    UNEXPECTED_TOKEN("Unexpected token"),
    KEY_MUST_BE_STRING("Object key must be a string"),
    EXPECTED_COLON("Expected ':' after object key"),
    EXPECTED_COMMA_OR_CLOSE_BRACE("Expected ',' or '}'"),
    EXPECTED_COMMA_OR_CLOSE_BRACKET("Expected ',' or ']'"),
    UNCLOSED_OBJECT("Object is not closed"),
    UNCLOSED_ARRAY("Array is not closed"),
    TRAILING_COMMA("Trailing comma"),
    NESTING_TOO_DEEP("Nesting too deep"),
    TRAILING_CONTENT("Unexpected content after document end");

    private final String description;

    JsonErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
