package su.grinev.jsontree.json.token;

/**
 * Forward-only character cursor over the source text with one character of lookahead.
 */
public class Buffer {

    private final CharSequence text;
    private int pos;

    public Buffer(CharSequence text) {
        this.text = text;
    }

    public boolean hasNext() {
        return pos < text.length();
    }

    public char peek() {
        return text.charAt(pos);
    }

    public char next() {
        return text.charAt(pos++);
    }

    public int size() {
        return text.length();
    }

    public String getString(int startPos, int endPos) {
        return text.subSequence(startPos, endPos).toString();
    }

    public int getPos() {
        return pos;
    }
}
