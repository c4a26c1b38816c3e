package betty.lexer;

/**
 * One lexeme of the source. {@code offset} is the index of its first character,
 * so the concatenation of every token's lexeme rebuilds the input exactly.
 */
public record Token(TokenType type, String lexeme, int line, int column, int offset) {

    public int endOffset() {
        return offset + lexeme.length();
    }

    /** Line of the last character; differs from {@link #line()} for multi-line comments and directives. */
    public int endLine() {
        int l = line;
        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') l++;
        }
        return l;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
