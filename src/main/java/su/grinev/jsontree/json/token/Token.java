package su.grinev.jsontree.json.token;

/**
 * Lexical unit produced by the tokenizer. Structural tokens and {@code null} are plain
 * instances, value-carrying tokens use the subclasses.
 */
public class Token {

    private final TokenType type;
    private final int pos;
    private final int end;

    public Token(TokenType tokenType, int pos, int end) {
        this.type = tokenType;
        this.pos = pos;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Offset of the first character of this token in the source text.
     */
    public int getPos() {
        return pos;
    }

    /**
     * Offset just past the last character of this token.
     */
    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return "Token{" +
                "type=" + type +
                ", pos=" + pos +
                '}';
    }
}
