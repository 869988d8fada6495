package su.grinev.jsontree.json;

import org.junit.jupiter.api.Test;
import su.grinev.jsontree.exception.JsonErrorKind;
import su.grinev.jsontree.exception.JsonParseException;
import su.grinev.jsontree.json.token.Token;
import su.grinev.jsontree.json.token.TokenType;
import su.grinev.jsontree.json.value.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonParserTests {

    @Test
    public void scalarRootTest() {
        assertSame(JsonNull.INSTANCE, parse("null"));
        assertEquals(new JsonBoolean(true), parse("true"));
        assertEquals(new JsonBoolean(false), parse("false"));
        assertEquals(-1500.0, parse("-1.5e3").asNumber());
        assertEquals("a\nb", parse("\"a\\nb\"").asString());
    }

    @Test
    public void emptyContainersTest() {
        JsonValue object = parse("{}");
        assertEquals(JsonValueType.OBJECT, object.type());
        assertTrue(object.asObject().isEmpty());

        JsonValue array = parse("[]");
        assertEquals(JsonValueType.ARRAY, array.type());
        assertTrue(array.asArray().isEmpty());
    }

    @Test
    public void arrayKeepsSourceOrderTest() {
        JsonArray array = parse("[1,2,3]").asArray();

        assertEquals(List.of(new JsonNumber(1), new JsonNumber(2), new JsonNumber(3)), array.values());
    }

    @Test
    public void duplicateKeyLastWinsTest() {
        JsonObject object = parse("{\"a\":1,\"a\":2}").asObject();

        assertEquals(1, object.size());
        assertEquals(2.0, object.get("a").asNumber());
    }

    @Test
    public void repeatedDuplicateKeyLastWinsTest() {
        JsonObject object = parse("{\"a\":1,\"b\":true,\"a\":2,\"a\":3}").asObject();

        assertEquals(2, object.size());
        assertEquals(3.0, object.get("a").asNumber());
        assertTrue(object.get("b").asBoolean());
    }

    @Test
    public void nestedDocumentTest() {
        JsonObject root = parse("""
                {
                    "name": "John Doe",
                    "age": 30,
                    "isStudent": false,
                    "spouse": null,
                    "courses": [
                        {"title": "History", "credits": 3},
                        {"title": "Math", "credits": 4.5}
                    ],
                    "matrix": [[1, 2], [], [3]]
                }
                """).asObject();

        assertEquals("John Doe", root.get("name").asString());
        assertEquals(30.0, root.get("age").asNumber());
        assertFalse(root.get("isStudent").asBoolean());
        assertTrue(root.get("spouse").isNull());

        JsonArray courses = root.get("courses").asArray();
        assertEquals(2, courses.size());
        assertEquals("History", courses.get(0).asObject().get("title").asString());
        assertEquals(4.5, courses.get(1).asObject().get("credits").asNumber());

        JsonArray matrix = root.get("matrix").asArray();
        assertEquals(3, matrix.size());
        assertEquals(2, matrix.get(0).asArray().size());
        assertTrue(matrix.get(1).asArray().isEmpty());
        assertEquals(3.0, matrix.get(2).asArray().get(0).asNumber());
    }

    @Test
    public void unclosedConstructsTest() {
        assertError(JsonErrorKind.UNCLOSED_OBJECT, 0, "{");
        assertError(JsonErrorKind.UNCLOSED_ARRAY, 0, "[");
        assertError(JsonErrorKind.UNCLOSED_OBJECT, 0, "{\"a\":1");
        assertError(JsonErrorKind.UNCLOSED_ARRAY, 0, "[1,2");
        assertError(JsonErrorKind.UNCLOSED_ARRAY, 0, "[1,");
        assertError(JsonErrorKind.UNCLOSED_OBJECT, 4, "[1, {\"a\"");
    }

    @Test
    public void missingValueTest() {
        assertError(JsonErrorKind.UNEXPECTED_END_OF_INPUT, 0, "");
        assertError(JsonErrorKind.UNEXPECTED_END_OF_INPUT, 5, "{\"a\":");
    }

    @Test
    public void unexpectedTokenTest() {
        assertError(JsonErrorKind.UNEXPECTED_TOKEN, 0, "}");
        assertError(JsonErrorKind.UNEXPECTED_TOKEN, 0, ",");
        assertError(JsonErrorKind.UNEXPECTED_TOKEN, 5, "{\"a\":]");
        assertError(JsonErrorKind.UNEXPECTED_TOKEN, 1, "[:]");
    }

    @Test
    public void objectSyntaxErrorsTest() {
        assertError(JsonErrorKind.KEY_MUST_BE_STRING, 1, "{1:2}");
        assertError(JsonErrorKind.KEY_MUST_BE_STRING, 1, "{null:2}");
        assertError(JsonErrorKind.EXPECTED_COLON, 5, "{\"a\" 1}");
        assertError(JsonErrorKind.EXPECTED_COLON, 4, "{\"a\"}");
        assertError(JsonErrorKind.EXPECTED_COMMA_OR_CLOSE_BRACE, 7, "{\"a\":1 \"b\":2}");
        assertError(JsonErrorKind.EXPECTED_COMMA_OR_CLOSE_BRACE, 6, "{\"a\":1]");
    }

    @Test
    public void arraySyntaxErrorsTest() {
        assertError(JsonErrorKind.EXPECTED_COMMA_OR_CLOSE_BRACKET, 3, "[1 2]");
        assertError(JsonErrorKind.EXPECTED_COMMA_OR_CLOSE_BRACKET, 2, "[1}");
        assertError(JsonErrorKind.UNEXPECTED_TOKEN, 1, "[,1]");
    }

    @Test
    public void trailingCommaIsRejectedTest() {
        assertError(JsonErrorKind.TRAILING_COMMA, 2, "[1,]");
        assertError(JsonErrorKind.TRAILING_COMMA, 6, "{\"a\":1,}");
        assertError(JsonErrorKind.TRAILING_COMMA, 7, "{\"a\":[1,]}");
    }

    @Test
    public void trailingContentTest() {
        assertError(JsonErrorKind.TRAILING_CONTENT, 3, "{} {}");
        assertError(JsonErrorKind.TRAILING_CONTENT, 2, "[]]");
        assertError(JsonErrorKind.TRAILING_CONTENT, 2, "1 2");
    }

    @Test
    public void lenientLiteralFollowedByValueTest() {
        JsonReaderOptions lenient = JsonReaderOptions.builder().strictLiterals(false).build();
        List<Token> tokens = new Tokenizer("[truefalse]", lenient).tokenize();

        JsonParseException e = assertThrows(JsonParseException.class, () -> new JsonParser(tokens, lenient).parse());
        assertEquals(JsonErrorKind.EXPECTED_COMMA_OR_CLOSE_BRACKET, e.getKind());
        assertEquals(5, e.getPosition());
    }

    @Test
    public void maxDepthTest() {
        JsonReaderOptions options = JsonReaderOptions.builder().maxDepth(3).build();

        JsonValue value = new JsonParser(new Tokenizer("[[{\"a\":[]}]]").tokenize(), JsonReaderOptions.defaults()).parse();
        assertEquals(1, value.asArray().size());

        assertDoesNotThrow(() -> new JsonParser(new Tokenizer("[[[1]]]").tokenize(), options).parse());

        JsonParseException e = assertThrows(JsonParseException.class,
                () -> new JsonParser(new Tokenizer("[[{\"a\":[]}]]").tokenize(), options).parse());
        assertEquals(JsonErrorKind.NESTING_TOO_DEEP, e.getKind());
        assertEquals(7, e.getPosition());
    }

    @Test
    public void defaultDepthGuardsAgainstDeepNestingTest() {
        int depth = JsonReaderOptions.DEFAULT_MAX_DEPTH + 1;
        String json = "[".repeat(depth) + "]".repeat(depth);

        JsonParseException e = assertThrows(JsonParseException.class, () -> parse(json));
        assertEquals(JsonErrorKind.NESTING_TOO_DEEP, e.getKind());
        assertEquals(JsonReaderOptions.DEFAULT_MAX_DEPTH, e.getPosition());

        String allowed = "[".repeat(depth - 1) + "]".repeat(depth - 1);
        assertEquals(JsonValueType.ARRAY, parse(allowed).type());
    }

    @Test
    public void parsesTokensWithoutSourceTextTest() {
        List<Token> tokens = List.of(
                new Token(TokenType.SQUARE_OPEN, 0, 1),
                new Token(TokenType.NULL, 1, 5),
                new Token(TokenType.SQUARE_CLOSE, 5, 6));

        JsonArray array = new JsonParser(tokens).parse().asArray();
        assertTrue(array.get(0).isNull());
    }

    private static JsonValue parse(String json) {
        return new JsonParser(new Tokenizer(json).tokenize()).parse();
    }

    private static void assertError(JsonErrorKind kind, int position, String json) {
        JsonParseException e = assertThrows(JsonParseException.class, () -> parse(json), json);
        assertEquals(kind, e.getKind(), json + " -> " + e.getMessage());
        assertEquals(position, e.getPosition(), json + " -> " + e.getMessage());
    }
}
