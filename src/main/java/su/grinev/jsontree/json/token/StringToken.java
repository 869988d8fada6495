package su.grinev.jsontree.json.token;

public class StringToken extends Token {

    private final String string;

    public StringToken(String string, int pos, int end) {
        super(TokenType.STRING, pos, end);
        this.string = string;
    }

    public String getString() {
        return string;
    }

    @Override
    public String toString() {
        return "StringToken{" +
                "string='" + string + '\'' +
                ", pos=" + getPos() +
                '}';
    }
}
