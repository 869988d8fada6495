package su.grinev.jsontree.json.token;

public class BooleanToken extends Token {

    private final boolean value;

    public BooleanToken(boolean value, int pos, int end) {
        super(TokenType.BOOLEAN, pos, end);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "BooleanToken{" +
                "value=" + value +
                ", pos=" + getPos() +
                '}';
    }
}
