package su.grinev.jsontree.json;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class JsonReaderOptions {

    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final JsonReaderOptions DEFAULTS = JsonReaderOptions.builder().build();

    /**
     * When set, {@code true}, {@code false} and {@code null} must be followed by whitespace,
     * a structural character or the end of input. When cleared, the literal is matched on its
     * fixed length only and whatever follows is tokenized separately.
     */
    private final boolean strictLiterals;

    /**
     * Maximum number of nested objects and arrays, at least 1.
     */
    private final int maxDepth;

    @Builder
    private JsonReaderOptions(boolean strictLiterals, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1 but was " + maxDepth);
        }
        this.strictLiterals = strictLiterals;
        this.maxDepth = maxDepth;
    }

    public static JsonReaderOptions defaults() {
        return DEFAULTS;
    }

    public static class JsonReaderOptionsBuilder {
        private boolean strictLiterals = true;
        private int maxDepth = DEFAULT_MAX_DEPTH;
    }
}
