package su.grinev.jsontree.json;

public enum ParserState {
    START,
    READING_MEMBER,
    EXPECT_SEPARATOR_OR_END,
    DONE
}
