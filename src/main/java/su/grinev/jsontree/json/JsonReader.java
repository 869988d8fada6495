package su.grinev.jsontree.json;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import su.grinev.jsontree.exception.JsonParseException;
import su.grinev.jsontree.json.token.Token;
import su.grinev.jsontree.json.value.JsonObject;
import su.grinev.jsontree.json.value.JsonValue;
import su.grinev.jsontree.json.value.JsonValueType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static su.grinev.jsontree.exception.JsonErrorKind.UNEXPECTED_TOKEN;

/**
 * JSON reader - wraps Tokenizer and JsonParser for convenience.
 * Both stages are single-use, so a fresh pair is created per call and the reader itself can be shared.
 */
@Slf4j
@Getter
public class JsonReader {

    private final JsonReaderOptions options;

    public JsonReader() {
        this(JsonReaderOptions.defaults());
    }

    public JsonReader(JsonReaderOptions options) {
        this.options = options;
    }

    public JsonValue read(String json) {
        List<Token> tokens = new Tokenizer(json, options).tokenize();
        return new JsonParser(tokens, options).parse();
    }

    public JsonValue read(byte[] jsonBytes) {
        return read(new String(jsonBytes, StandardCharsets.UTF_8));
    }

    public JsonValue read(InputStream inputStream) throws IOException {
        byte[] data = inputStream.readAllBytes();
        log.debug("Read {} bytes from stream", data.length);
        return read(data);
    }

    /**
     * Reads a document whose root must be an object, as configuration files usually are.
     */
    public JsonObject readObject(String json) {
        JsonValue root = read(json);
        if (root.type() != JsonValueType.OBJECT) {
            throw new JsonParseException(UNEXPECTED_TOKEN, firstNonWhitespace(json), "expected an object at document root but was " + root.type());
        }
        return root.asObject();
    }

    private static int firstNonWhitespace(String json) {
        int pos = 0;
        while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
