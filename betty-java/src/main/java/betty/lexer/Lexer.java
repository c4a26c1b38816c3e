package betty.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits C source into tokens without discarding anything: whitespace, newlines and
 * comments are tokens too. Bad input never stops the scan; it yields an
 * {@link TokenType#ERROR} token and bumps {@link #errorCount()}.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private int start;
    private int startLine;
    private int startCol;

    private int errorCount = 0;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("do", TokenType.DO),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("goto", TokenType.GOTO),
            Map.entry("typedef", TokenType.TYPEDEF),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("union", TokenType.UNION),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("sizeof", TokenType.SIZEOF),
            Map.entry("void", TokenType.VOID),
            Map.entry("char", TokenType.CHAR),
            Map.entry("short", TokenType.SHORT),
            Map.entry("int", TokenType.INT),
            Map.entry("long", TokenType.LONG),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("double", TokenType.DOUBLE),
            Map.entry("signed", TokenType.SIGNED),
            Map.entry("unsigned", TokenType.UNSIGNED),
            Map.entry("const", TokenType.CONST),
            Map.entry("volatile", TokenType.VOLATILE),
            Map.entry("static", TokenType.STATIC),
            Map.entry("extern", TokenType.EXTERN),
            Map.entry("auto", TokenType.AUTO),
            Map.entry("register", TokenType.REGISTER),
            Map.entry("inline", TokenType.INLINE)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = pos;
            startLine = line;
            startCol = col;

            char c = advance();

            switch (c) {
                case ' ', '\t', '\r', '\f', '\u000B' -> whitespace();
                case '\n' -> add(TokenType.NEWLINE);

                case '(' -> add(TokenType.LPAREN);
                case ')' -> add(TokenType.RPAREN);
                case '{' -> add(TokenType.LBRACE);
                case '}' -> add(TokenType.RBRACE);
                case '[' -> add(TokenType.LBRACKET);
                case ']' -> add(TokenType.RBRACKET);
                case ';' -> add(TokenType.SEMICOLON);
                case ',' -> add(TokenType.COMMA);
                case '~' -> add(TokenType.TILDE);
                case '?' -> add(TokenType.QUESTION);
                case ':' -> add(TokenType.COLON);

                case '.' -> {
                    if (peek() == '.' && peekNext() == '.') {
                        advance();
                        advance();
                        add(TokenType.ELLIPSIS);
                    } else if (isDigit(peek())) {
                        numberFraction();
                    } else {
                        add(TokenType.DOT);
                    }
                }

                case '+' -> {
                    if (match('+')) add(TokenType.INCREMENT);
                    else if (match('=')) add(TokenType.PLUS_ASSIGN);
                    else add(TokenType.PLUS);
                }
                case '-' -> {
                    if (match('-')) add(TokenType.DECREMENT);
                    else if (match('=')) add(TokenType.MINUS_ASSIGN);
                    else if (match('>')) add(TokenType.ARROW);
                    else add(TokenType.MINUS);
                }
                case '*' -> add(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                case '%' -> add(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
                case '^' -> add(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
                case '=' -> add(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                case '!' -> add(match('=') ? TokenType.NEQ : TokenType.NOT);

                case '<' -> {
                    if (match('=')) add(TokenType.LE);
                    else if (match('<')) add(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                    else add(TokenType.LT);
                }
                case '>' -> {
                    if (match('=')) add(TokenType.GE);
                    else if (match('>')) add(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                    else add(TokenType.GT);
                }
                case '&' -> {
                    if (match('&')) add(TokenType.AND);
                    else if (match('=')) add(TokenType.AMP_ASSIGN);
                    else add(TokenType.AMP);
                }
                case '|' -> {
                    if (match('|')) add(TokenType.OR);
                    else if (match('=')) add(TokenType.PIPE_ASSIGN);
                    else add(TokenType.PIPE);
                }

                case '/' -> {
                    if (match('/')) lineComment();
                    else if (match('*')) blockComment();
                    else add(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }

                case '#' -> preprocessor();
                case '"' -> stringLiteral();
                case '\'' -> charLiteral();

                default -> {
                    if (isDigit(c)) numberLiteral(c);
                    else if (isAlpha(c)) identifier();
                    else error("Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col, pos));
        return tokens;
    }

    public int errorCount() {
        return errorCount;
    }

    // ================= helpers =================

    private void whitespace() {
        while (!isAtEnd() && isHorizontalSpace(peek())) advance();
        add(TokenType.WHITESPACE);
    }

    private void numberLiteral(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (!isAtEnd() && isHexDigit(peek())) advance();
            integerSuffix();
            add(TokenType.INT_LITERAL);
            return;
        }
        if (first == '0' && isDigit(peek())) {
            while (!isAtEnd() && peek() >= '0' && peek() <= '7') advance();
            integerSuffix();
            add(TokenType.INT_LITERAL);
            return;
        }

        while (!isAtEnd() && isDigit(peek())) advance();

        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (!isAtEnd() && isDigit(peek())) advance();
        }
        isFloat |= exponentAndSuffix();

        if (!isFloat) integerSuffix();
        add(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL);
    }

    // ".5" style literal; the dot is already consumed
    private void numberFraction() {
        while (!isAtEnd() && isDigit(peek())) advance();
        exponentAndSuffix();
        add(TokenType.FLOAT_LITERAL);
    }

    private boolean exponentAndSuffix() {
        boolean isFloat = false;
        if (peek() == 'e' || peek() == 'E') {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (!isAtEnd() && isDigit(peek())) advance();
        }
        if (peek() == 'f' || peek() == 'F') {
            isFloat = true;
            advance();
        }
        return isFloat;
    }

    private void integerSuffix() {
        while (!isAtEnd() && (peek() == 'u' || peek() == 'U' || peek() == 'l' || peek() == 'L')) {
            advance();
        }
    }

    private void identifier() {
        while (!isAtEnd() && isAlphaNumeric(peek())) advance();

        String text = source.substring(start, pos);
        add(keywords.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void stringLiteral() {
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (advance() == '\\' && !isAtEnd()) {
                if (peek() == '\n') {
                    error("Unterminated string");
                    return;
                }
                advance();
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // closing "
        add(TokenType.STRING_LITERAL);
    }

    private void charLiteral() {
        while (!isAtEnd() && peek() != '\'' && peek() != '\n') {
            if (advance() == '\\' && !isAtEnd() && peek() != '\n') advance();
        }

        if (isAtEnd() || peek() != '\'') {
            error("Unterminated character literal");
            return;
        }

        advance(); // closing '
        add(TokenType.CHAR_LITERAL);
    }

    private void lineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
        add(TokenType.LINE_COMMENT);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                add(TokenType.BLOCK_COMMENT);
                return;
            }
            advance();
        }
        // an unclosed comment still keeps its text
        add(TokenType.BLOCK_COMMENT);
    }

    private void preprocessor() {
        while (!isAtEnd()) {
            if (peek() == '\\' && peekNext() == '\n') {
                advance();
                advance();
            } else if (peek() == '\\' && peekNext() == '\r' && pos + 2 < source.length()
                    && source.charAt(pos + 2) == '\n') {
                advance();
                advance();
                advance();
            } else if (peek() == '\n') {
                break;
            } else {
                advance();
            }
        }
        add(TokenType.PREPROCESSOR);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type) {
        tokens.add(new Token(type, source.substring(start, pos), startLine, startCol, start));
    }

    private void error(String message) {
        errorCount++;
        LOG.debug("[{}:{}] {}", startLine, startCol, message);
        add(TokenType.ERROR);
    }
}
