package betty.ast;

public enum NodeKind {
    PROGRAM,

    // declarations
    FUNCTION, VAR_DECL, STRUCT, UNION, ENUM, ENUM_VALUE, TYPEDEF, PARAM, FUNC_PTR,

    // statements
    BLOCK, IF, WHILE, FOR, DO_WHILE, SWITCH, CASE,
    RETURN, BREAK, CONTINUE, GOTO, LABEL, EXPR_STMT,

    // expressions
    BINARY, UNARY, TERNARY, CALL, LITERAL, IDENTIFIER, MEMBER_ACCESS, ARRAY_ACCESS,
    CAST, SIZEOF, PAREN, TYPE_NAME, INIT_LIST,

    // layout
    PREPROCESSOR, UNPARSED;

    public boolean isAggregate() {
        return this == STRUCT || this == UNION || this == ENUM;
    }
}
