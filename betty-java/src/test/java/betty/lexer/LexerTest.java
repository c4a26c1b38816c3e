package betty.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    // significant tokens only, EOF dropped
    private static List<TokenType> types(String src) {
        return lex(src).stream()
                .filter(t -> !t.type().isTrivia() && t.type() != TokenType.EOF)
                .map(Token::type)
                .toList();
    }

    @Test
    void lex_keeps_every_character() {
        String src = "#include <stdio.h>\n\nint main(void)\r\n{\t/* hi */\n  return 0; // bye\n}\n";
        var toks = lex(src);
        String rebuilt = toks.stream().map(Token::lexeme).collect(Collectors.joining());
        assertEquals(src, rebuilt);
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());
    }

    @Test
    void lex_offsets_are_contiguous() {
        int expected = 0;
        for (Token t : lex("a  += b->c; /* x */\n'q'")) {
            assertEquals(expected, t.offset(), t.toString());
            expected = t.endOffset();
        }
    }

    @Test
    void lex_longest_match_operators() {
        assertEquals(List.of(
                TokenType.SHL_ASSIGN, TokenType.SHL, TokenType.LE, TokenType.LT,
                TokenType.SHR_ASSIGN, TokenType.ARROW, TokenType.INCREMENT, TokenType.DECREMENT,
                TokenType.ELLIPSIS, TokenType.AND, TokenType.OR, TokenType.NEQ, TokenType.EQ
        ), types("<<= << <= < >>= -> ++ -- ... && || != =="));
    }

    @Test
    void lex_compound_assignments() {
        var ts = types("+= -= *= /= %= &= |= ^=");
        assertEquals(8, ts.size());
        assertTrue(ts.stream().allMatch(TokenType::isAssignment));
    }

    static Stream<String[]> numbers() {
        return Stream.of(
                new String[]{"42", "INT_LITERAL"},
                new String[]{"0x1Fu", "INT_LITERAL"},
                new String[]{"017", "INT_LITERAL"},
                new String[]{"42UL", "INT_LITERAL"},
                new String[]{"3.14f", "FLOAT_LITERAL"},
                new String[]{"1e-5", "FLOAT_LITERAL"},
                new String[]{".5", "FLOAT_LITERAL"},
                new String[]{"2.5E+3", "FLOAT_LITERAL"}
        );
    }

    @ParameterizedTest
    @MethodSource("numbers")
    void lex_number_literal(String text, String type) {
        var toks = lex(text);
        assertEquals(2, toks.size(), "one literal plus EOF");
        assertEquals(TokenType.valueOf(type), toks.get(0).type());
        assertEquals(text, toks.get(0).lexeme());
    }

    @Test
    void lex_dot_without_digit_is_member_access() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER), types("s.x"));
    }

    @Test
    void lex_keywords_vs_identifiers() {
        assertEquals(List.of(TokenType.INT, TokenType.IDENTIFIER, TokenType.INLINE, TokenType.GOTO,
                TokenType.IDENTIFIER), types("int integer inline goto _tmp1"));
    }

    @Test
    void lex_string_and_char_escapes() {
        var toks = lex("\"a\\\"b\" '\\''");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("\"a\\\"b\"", toks.get(0).lexeme());
        assertEquals(TokenType.CHAR_LITERAL, toks.get(2).type());
        assertEquals("'\\''", toks.get(2).lexeme());
    }

    @Test
    void lex_unterminated_string_counts_error_and_continues() {
        var lexer = new Lexer("char *s = \"abc\nint x;");
        var toks = lexer.tokenize();

        assertEquals(1, lexer.errorCount());
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());

        var error = toks.stream().filter(t -> t.type() == TokenType.ERROR).findFirst().orElseThrow();
        assertEquals("\"abc", error.lexeme());
        // scanning picks up again on the next line
        assertTrue(toks.stream().anyMatch(t -> t.type() == TokenType.INT && t.line() == 2));
    }

    @Test
    void lex_unexpected_character() {
        var lexer = new Lexer("a @ b");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ERROR, TokenType.IDENTIFIER),
                lexer.tokenize().stream()
                        .filter(t -> !t.type().isTrivia() && t.type() != TokenType.EOF)
                        .map(Token::type)
                        .toList());
        assertEquals(1, lexer.errorCount());
    }

    @Test
    void lex_preprocessor_with_continuation() {
        var toks = lex("#define MAX(a, b) \\\n\t((a) > (b))\nint x;");
        assertEquals(TokenType.PREPROCESSOR, toks.get(0).type());
        assertEquals("#define MAX(a, b) \\\n\t((a) > (b))", toks.get(0).lexeme());
        assertEquals(2, toks.get(0).endLine());
        assertEquals(TokenType.NEWLINE, toks.get(1).type());
        assertEquals(3, toks.get(2).line());
    }

    @Test
    void lex_comments() {
        var toks = lex("x // hi\ny");
        assertEquals(TokenType.LINE_COMMENT, toks.get(2).type());
        assertEquals("// hi", toks.get(2).lexeme());
        assertEquals(TokenType.NEWLINE, toks.get(3).type());

        toks = lex("/* a\n b */x");
        assertEquals(TokenType.BLOCK_COMMENT, toks.get(0).type());
        assertEquals(2, toks.get(1).line());
        assertEquals(6, toks.get(1).column());
    }

    @Test
    void lex_unclosed_block_comment_is_kept() {
        var lexer = new Lexer("int x; /* open");
        var toks = lexer.tokenize();
        assertEquals("/* open", toks.get(toks.size() - 2).lexeme());
        assertEquals(0, lexer.errorCount());
    }

    @Test
    void lex_whitespace_kinds() {
        var toks = lex(" \t\f\n");
        assertEquals(TokenType.WHITESPACE, toks.get(0).type());
        assertEquals(" \t\f", toks.get(0).lexeme());
        assertEquals(TokenType.NEWLINE, toks.get(1).type());
    }
}
