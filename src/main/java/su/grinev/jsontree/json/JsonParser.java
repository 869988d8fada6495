package su.grinev.jsontree.json;

import lombok.extern.slf4j.Slf4j;
import su.grinev.jsontree.exception.JsonErrorKind;
import su.grinev.jsontree.exception.JsonParseException;
import su.grinev.jsontree.json.token.BooleanToken;
import su.grinev.jsontree.json.token.NumberToken;
import su.grinev.jsontree.json.token.StringToken;
import su.grinev.jsontree.json.token.Token;
import su.grinev.jsontree.json.token.TokenType;
import su.grinev.jsontree.json.value.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static su.grinev.jsontree.exception.JsonErrorKind.*;
import static su.grinev.jsontree.json.ParserState.*;
import static su.grinev.jsontree.json.token.TokenType.*;

/**
 * Recursive descent parser over the token list produced by {@link Tokenizer}.
 * The cursor only moves forward. An instance parses its tokens once.
 */
@Slf4j
public class JsonParser {

    private final List<Token> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;

    public JsonParser(List<Token> tokens) {
        this(tokens, JsonReaderOptions.defaults());
    }

    public JsonParser(List<Token> tokens, JsonReaderOptions options) {
        this.tokens = tokens;
        this.maxDepth = options.getMaxDepth();
    }

    public JsonValue parse() {
        JsonValue root = parseValue();
        Token trailing = peek();
        if (trailing != null) {
            throw new JsonParseException(TRAILING_CONTENT, trailing.getPos(), "token: " + trailing.getType());
        }
        log.debug("Parsed {} tokens into {}", tokens.size(), root.type());
        return root;
    }

    private JsonValue parseValue() {
        Token token = peek();
        if (token == null) {
            throw new JsonParseException(UNEXPECTED_END_OF_INPUT, endOfInput());
        }

        return switch (token.getType()) {
            case CURLY_OPEN -> parseObject();
            case SQUARE_OPEN -> parseArray();
            case STRING -> new JsonString(((StringToken) advance()).getString());
            case NUMBER -> new JsonNumber(((NumberToken) advance()).getNumber());
            case BOOLEAN -> JsonBoolean.of(((BooleanToken) advance()).getValue());
            case NULL -> {
                advance();
                yield JsonNull.INSTANCE;
            }
            default -> throw new JsonParseException(UNEXPECTED_TOKEN, token.getPos(), "token: " + token.getType());
        };
    }

    private JsonObject parseObject() {
        Token open = advance();
        enter(open);
        Map<String, JsonValue> members = new HashMap<>();
        ParserState state = START;

        while (state != DONE) {
            Token token = peek();
            if (token == null) {
                throw new JsonParseException(UNCLOSED_OBJECT, open.getPos());
            }

            switch (state) {
                case START -> {
                    if (token.getType() == CURLY_CLOSE) {
                        advance();
                        state = DONE;
                    } else {
                        state = READING_MEMBER;
                    }
                }
                case READING_MEMBER -> {
                    if (token.getType() != STRING) {
                        throw new JsonParseException(KEY_MUST_BE_STRING, token.getPos(), "token: " + token.getType());
                    }
                    String key = ((StringToken) advance()).getString();
                    expect(COLON, EXPECTED_COLON, UNCLOSED_OBJECT, open);
                    JsonValue value = parseValue();
                    if (members.put(key, value) != null) {
                        log.debug("Duplicate key '{}' at pos: {}, keeping the last value", key, token.getPos());
                    }
                    state = EXPECT_SEPARATOR_OR_END;
                }
                case EXPECT_SEPARATOR_OR_END -> {
                    state = separatorOrEnd(token, CURLY_CLOSE, EXPECTED_COMMA_OR_CLOSE_BRACE);
                }
            }
        }

        depth--;
        return new JsonObject(members);
    }

    private JsonArray parseArray() {
        Token open = advance();
        enter(open);
        List<JsonValue> values = new ArrayList<>();
        ParserState state = START;

        while (state != DONE) {
            Token token = peek();
            if (token == null) {
                throw new JsonParseException(UNCLOSED_ARRAY, open.getPos());
            }

            switch (state) {
                case START -> {
                    if (token.getType() == SQUARE_CLOSE) {
                        advance();
                        state = DONE;
                    } else {
                        state = READING_MEMBER;
                    }
                }
                case READING_MEMBER -> {
                    values.add(parseValue());
                    state = EXPECT_SEPARATOR_OR_END;
                }
                case EXPECT_SEPARATOR_OR_END -> {
                    state = separatorOrEnd(token, SQUARE_CLOSE, EXPECTED_COMMA_OR_CLOSE_BRACKET);
                }
            }
        }

        depth--;
        return new JsonArray(values);
    }

    /**
     * Consumes a comma or the closing token. A comma directly followed by the closing token is rejected.
     */
    private ParserState separatorOrEnd(Token token, TokenType close, JsonErrorKind mismatch) {
        if (token.getType() == close) {
            advance();
            return DONE;
        }
        if (token.getType() != COMMA) {
            throw new JsonParseException(mismatch, token.getPos(), "token: " + token.getType());
        }

        advance();
        Token next = peek();
        if (next != null && next.getType() == close) {
            throw new JsonParseException(TRAILING_COMMA, token.getPos());
        }
        return READING_MEMBER;
    }

    private void expect(TokenType type, JsonErrorKind mismatch, JsonErrorKind endOfInput, Token open) {
        Token token = peek();
        if (token == null) {
            throw new JsonParseException(endOfInput, open.getPos());
        }
        if (token.getType() != type) {
            throw new JsonParseException(mismatch, token.getPos(), "token: " + token.getType());
        }
        advance();
    }

    private void enter(Token open) {
        if (++depth > maxDepth) {
            throw new JsonParseException(NESTING_TOO_DEEP, open.getPos(), "max depth: " + maxDepth);
        }
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private int endOfInput() {
        return tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getEnd();
    }
}
