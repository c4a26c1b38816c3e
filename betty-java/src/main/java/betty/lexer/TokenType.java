package betty.lexer;

public enum TokenType {

    // layout
    WHITESPACE,
    NEWLINE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    PREPROCESSOR,

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,

    // control keywords
    IF, ELSE, WHILE, FOR, DO,
    SWITCH, CASE, DEFAULT,
    BREAK, CONTINUE, RETURN, GOTO,

    // declaration keywords
    TYPEDEF, STRUCT, UNION, ENUM, SIZEOF,

    // types
    VOID, CHAR, SHORT, INT, LONG, FLOAT, DOUBLE,
    SIGNED, UNSIGNED,

    // qualifiers / storage
    CONST, VOLATILE, STATIC, EXTERN, AUTO, REGISTER, INLINE,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
    AMP_ASSIGN, PIPE_ASSIGN, CARET_ASSIGN, SHL_ASSIGN, SHR_ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    AMP, PIPE, CARET, TILDE,
    SHL, SHR,
    INCREMENT, DECREMENT,
    ARROW, DOT, ELLIPSIS,
    QUESTION, COLON,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    SEMICOLON, COMMA,

    ERROR,
    EOF;

    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE || isComment();
    }

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                 AMP_ASSIGN, PIPE_ASSIGN, CARET_ASSIGN, SHL_ASSIGN, SHR_ASSIGN -> true;
            default -> false;
        };
    }
}
