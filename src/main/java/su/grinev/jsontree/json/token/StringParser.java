package su.grinev.jsontree.json.token;

import su.grinev.jsontree.exception.JsonParseException;

import static su.grinev.jsontree.exception.JsonErrorKind.INVALID_ESCAPE;
import static su.grinev.jsontree.exception.JsonErrorKind.UNTERMINATED_STRING;

/**
 * Scans a quoted string starting at the current buffer position.
 * Strings without escapes are cut straight out of the source, the rest are decoded char by char.
 */
public class StringParser {

    private final Buffer buffer;

    public StringParser(Buffer buffer) {
        this.buffer = buffer;
    }

    public StringToken parseString() {
        int tokenPos = buffer.getPos();
        buffer.next();
        int startPos = buffer.getPos();

        while (buffer.hasNext()) {
            char c = buffer.peek();
            if (c == '"') {
                String plain = buffer.getString(startPos, buffer.getPos());
                buffer.next();
                return new StringToken(plain, tokenPos, buffer.getPos());
            }
            if (c == '\\') {
                break;
            }
            buffer.next();
        }

        StringBuilder sb = new StringBuilder(buffer.getPos() - startPos + 16);
        sb.append(buffer.getString(startPos, buffer.getPos()));
        while (true) {
            if (!buffer.hasNext()) {
                throw new JsonParseException(UNTERMINATED_STRING, tokenPos);
            }

            char c = buffer.next();
            if (c == '"') break;
            if (c == '\\') {
                int escapePos = buffer.getPos() - 1;
                if (!buffer.hasNext()) {
                    throw new JsonParseException(UNTERMINATED_STRING, tokenPos);
                }
                char esc = buffer.next();
                sb.append(switch (esc) {
                    case '"' -> '"';
                    case '\\' -> '\\';
                    case '/' -> '/';
                    case 'b' -> '\b';
                    case 'f' -> '\f';
                    case 'n' -> '\n';
                    case 'r' -> '\r';
                    case 't' -> '\t';
                    // unicode escapes are not decoded
                    default -> throw new JsonParseException(INVALID_ESCAPE, escapePos, "character: '\\%s'".formatted(esc));
                });
            } else {
                sb.append(c);
            }
        }
        return new StringToken(sb.toString(), tokenPos, buffer.getPos());
    }
}
