package su.grinev.jsontree.exception;

import lombok.Getter;

/**
 * Thrown by the tokenizer and the parser on the first malformed input they meet.
 * Carries the error kind and the character offset in the source text.
 */
@Getter
public class JsonParseException extends RuntimeException {

    private final JsonErrorKind kind;
    private final int position;

    public JsonParseException(JsonErrorKind kind, int position) {
        this(kind, position, null);
    }

    public JsonParseException(JsonErrorKind kind, int position, String detail) {
        super(buildMessage(kind, position, detail));
        this.kind = kind;
        this.position = position;
    }

    public JsonParseException(JsonErrorKind kind, int position, String detail, Throwable cause) {
        super(buildMessage(kind, position, detail), cause);
        this.kind = kind;
        this.position = position;
    }

    private static String buildMessage(JsonErrorKind kind, int position, String detail) {
        if (detail == null) {
            return "%s at pos: %s".formatted(kind.getDescription(), position);
        }
        return "%s at pos: %s %s".formatted(kind.getDescription(), position, detail);
    }
}
