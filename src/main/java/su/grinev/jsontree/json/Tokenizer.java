package su.grinev.jsontree.json;

import lombok.extern.slf4j.Slf4j;
import su.grinev.jsontree.exception.JsonParseException;
import su.grinev.jsontree.json.token.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static su.grinev.jsontree.exception.JsonErrorKind.*;
import static su.grinev.jsontree.json.token.TokenType.*;

@Slf4j
public class Tokenizer {
    private static final String TRUE = "true";
    private static final String FALSE = "false";
    private static final String NULL = "null";
    private final Buffer buffer;
    private final StringParser stringParser;
    private final boolean strictLiterals;

    public Tokenizer(CharSequence json) {
        this(json, JsonReaderOptions.defaults());
    }

    public Tokenizer(CharSequence json, JsonReaderOptions options) {
        this.buffer = new Buffer(json);
        this.stringParser = new StringParser(buffer);
        this.strictLiterals = options.isStrictLiterals();
    }

    public Tokenizer(byte[] jsonBytes) {
        this(new String(jsonBytes, StandardCharsets.UTF_8));
    }

    public Tokenizer(byte[] jsonBytes, JsonReaderOptions options) {
        this(new String(jsonBytes, StandardCharsets.UTF_8), options);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (buffer.hasNext()) {
            skipWhitespace();
            if (!buffer.hasNext()) break;
            char c = buffer.peek();

            Token token = switch (c) {
                case '{' -> structural(CURLY_OPEN);
                case '}' -> structural(CURLY_CLOSE);
                case '[' -> structural(SQUARE_OPEN);
                case ']' -> structural(SQUARE_CLOSE);
                case ':' -> structural(COLON);
                case ',' -> structural(COMMA);
                case 't' -> parseLiteral(TRUE);
                case 'f' -> parseLiteral(FALSE);
                case 'n' -> parseLiteral(NULL);
                case '"' -> stringParser.parseString();
                default -> {
                    if ((c == '-') || (c >= '0' && c <= '9')) {
                        yield parseNumber();
                    }
                    throw new JsonParseException(UNEXPECTED_CHARACTER, buffer.getPos(), "character: '%s'".formatted(c));
                }
            };

            tokens.add(token);
        }
        log.debug("Tokenized {} chars into {} tokens", buffer.size(), tokens.size());
        return tokens;
    }

    private Token structural(TokenType type) {
        int pos = buffer.getPos();
        buffer.next();
        return new Token(type, pos, pos + 1);
    }

    private void skipWhitespace() {
        while (buffer.hasNext() && Character.isWhitespace(buffer.peek())) {
            buffer.next();
        }
    }

    private Token parseLiteral(String expected) {
        int startPos = buffer.getPos();
        StringBuilder sb = new StringBuilder(expected.length());
        for (int i = 0; i < expected.length() && buffer.hasNext(); i++) {
            sb.append(buffer.next());
        }

        if (!expected.contentEquals(sb)) {
            throw new JsonParseException(INVALID_LITERAL, startPos, "expected '%s'".formatted(expected));
        }
        if (strictLiterals && buffer.hasNext() && !isDelimiter(buffer.peek())) {
            throw new JsonParseException(INVALID_LITERAL, startPos, "expected '%s' followed by a delimiter".formatted(expected));
        }

        int end = buffer.getPos();
        return switch (expected) {
            case TRUE -> new BooleanToken(true, startPos, end);
            case FALSE -> new BooleanToken(false, startPos, end);
            default -> new Token(TokenType.NULL, startPos, end);
        };
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c)
                || c == ',' || c == ':'
                || c == '{' || c == '}'
                || c == '[' || c == ']';
    }

    private NumberToken parseNumber() {
        int startPos = buffer.getPos();
        while (buffer.hasNext() && isNumberChar(buffer.peek())) {
            buffer.next();
        }

        String run = buffer.getString(startPos, buffer.getPos());
        try {
            return new NumberToken(Double.parseDouble(run), startPos, buffer.getPos());
        } catch (NumberFormatException e) {
            throw new JsonParseException(INVALID_NUMBER, startPos, "value: '%s'".formatted(run), e);
        }
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
    }
}
