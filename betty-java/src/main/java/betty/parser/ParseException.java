package betty.parser;

import betty.lexer.Token;

public final class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(Token at, String msg) {
        super("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
        this.token = at;
    }

    public Token token() { return token; }
}
