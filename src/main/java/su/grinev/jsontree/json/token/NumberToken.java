package su.grinev.jsontree.json.token;

public class NumberToken extends Token {

    private final double number;

    public NumberToken(double number, int pos, int end) {
        super(TokenType.NUMBER, pos, end);
        this.number = number;
    }

    public double getNumber() {
        return number;
    }

    @Override
    public String toString() {
        return "NumberToken{" +
                "number=" + number +
                ", pos=" + getPos() +
                '}';
    }
}
