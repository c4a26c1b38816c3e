package betty.parser;

import betty.ast.Node;
import betty.ast.NodeKind;
import betty.ast.Payload;
import betty.lexer.Lexer;
import betty.lexer.Token;
import betty.sema.SymbolKind;
import betty.sema.SymbolTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Node parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parseProgram();
    }

    private static Node body(Node function) {
        return function.child(function.childCount() - 1);
    }

    // the expression of a single statement wrapped in a function
    private static String expr(String statement) {
        var p = parse("void f(void)\n{\n\t" + statement + "\n}\n");
        Node stmt = body(p.child(0)).child(0);
        assertEquals(NodeKind.EXPR_STMT, stmt.kind(), stmt.toString());
        return stmt.child(0).toString();
    }

    private static List<String> lexemes(List<Token> tokens) {
        return tokens.stream().map(Token::lexeme).toList();
    }

    @Test
    void parse_function_definition() {
        var p = parse("int add(int a,int b){return a+b;}");
        assertEquals(1, p.childCount());

        var fn = p.child(0);
        assertEquals(NodeKind.FUNCTION, fn.kind());
        assertEquals("add", fn.token().lexeme());
        var info = fn.payload(Payload.FunctionInfo.class);
        assertTrue(info.definition());
        assertEquals(List.of("int"), lexemes(info.returnType()));

        assertEquals(NodeKind.PARAM, fn.child(0).kind());
        assertEquals("b", fn.child(1).token().lexeme());
        assertEquals("RETURN('return')[BINARY('+')[IDENTIFIER('a'), IDENTIFIER('b')]]",
                body(fn).child(0).toString());
    }

    @Test
    void parse_prototype_with_pointers_and_variadic() {
        var fn = parse("char **split(const char *s, ...);").child(0);
        var info = fn.payload(Payload.FunctionInfo.class);
        assertFalse(info.definition());
        assertEquals(2, info.pointer().size());
        assertEquals(2, fn.childCount());
        assertEquals(List.of("const", "char"), lexemes(fn.child(0).payload(Payload.ParamInfo.class).type()));
        assertEquals("...", fn.child(1).token().lexeme());
    }

    @Test
    void parse_typedef_name_as_declaration_type() {
        var p = parse("typedef int myint;\nmyint x = 5;");
        assertEquals(NodeKind.TYPEDEF, p.child(0).kind());

        var decl = p.child(1);
        assertEquals(NodeKind.VAR_DECL, decl.kind());
        var info = decl.payload(Payload.VarDeclInfo.class);
        assertEquals(List.of("myint"), lexemes(info.type()));
        assertEquals("x", info.declarators().get(0).name().lexeme());
        assertTrue(info.declarators().get(0).initialized());
        assertEquals("LITERAL('5')", decl.child(0).toString());
    }

    @Test
    void parse_typedef_struct_then_pointer_declaration() {
        var p = parse("typedef struct { int v; } foo_t;\nfoo_t *x;");
        var typedef = p.child(0);
        assertEquals(NodeKind.TYPEDEF, typedef.kind());
        assertEquals(NodeKind.STRUCT, typedef.child(0).kind());

        var decl = p.child(1);
        assertEquals(NodeKind.VAR_DECL, decl.kind());
        var d = decl.payload(Payload.VarDeclInfo.class).declarators().get(0);
        assertEquals(1, d.pointer().size());
        assertEquals("x", d.name().lexeme());
    }

    @Test
    void parse_block_scoped_typedef_enables_cast() {
        var p = parse("void f(void)\n{\n\ttypedef long word;\n\ty = (word)x;\n}\n");
        var stmt = body(p.child(0)).child(1);
        assertEquals("CAST('(')[IDENTIFIER('x')]", stmt.child(0).child(1).toString());
    }

    static Stream<String[]> expressions() {
        return Stream.of(
                new String[]{"a + b * c;",
                        "BINARY('+')[IDENTIFIER('a'), BINARY('*')[IDENTIFIER('b'), IDENTIFIER('c')]]"},
                new String[]{"a - b - c;",
                        "BINARY('-')[BINARY('-')[IDENTIFIER('a'), IDENTIFIER('b')], IDENTIFIER('c')]"},
                new String[]{"a = b = c;",
                        "BINARY('=')[IDENTIFIER('a'), BINARY('=')[IDENTIFIER('b'), IDENTIFIER('c')]]"},
                new String[]{"a ? b : c ? d : e;",
                        "TERNARY('?')[IDENTIFIER('a'), IDENTIFIER('b'), "
                                + "TERNARY('?')[IDENTIFIER('c'), IDENTIFIER('d'), IDENTIFIER('e')]]"},
                new String[]{"a || b && c;",
                        "BINARY('||')[IDENTIFIER('a'), BINARY('&&')[IDENTIFIER('b'), IDENTIFIER('c')]]"},
                new String[]{"x += y << 2;",
                        "BINARY('+=')[IDENTIFIER('x'), BINARY('<<')[IDENTIFIER('y'), LITERAL('2')]]"},
                new String[]{"(size_t)n;", "CAST('(')[IDENTIFIER('n')]"},
                new String[]{"(a) * b;", "BINARY('*')[PAREN('(')[IDENTIFIER('a')], IDENTIFIER('b')]"},
                new String[]{"*p++;", "UNARY('*')[UNARY('++')[IDENTIFIER('p')]]"},
                new String[]{"p->next.v[2];",
                        "ARRAY_ACCESS('[')[MEMBER_ACCESS('v')[MEMBER_ACCESS('next')[IDENTIFIER('p')]], LITERAL('2')]"},
                new String[]{"f(a, 1);", "CALL('(')[IDENTIFIER('f'), IDENTIFIER('a'), LITERAL('1')]"},
                new String[]{"n = sizeof(int);", "BINARY('=')[IDENTIFIER('n'), SIZEOF('sizeof')]"},
                new String[]{"n = sizeof x;", "BINARY('=')[IDENTIFIER('n'), SIZEOF('sizeof')[IDENTIFIER('x')]]"},
                new String[]{"p = malloc(sizeof(Token *) * n);",
                        "BINARY('=')[IDENTIFIER('p'), CALL('(')[IDENTIFIER('malloc'), "
                                + "BINARY('*')[SIZEOF('sizeof'), IDENTIFIER('n')]]]"},
                new String[]{"n = sizeof(*p);",
                        "BINARY('=')[IDENTIFIER('n'), SIZEOF('sizeof')[PAREN('(')[UNARY('*')[IDENTIFIER('p')]]]]"},
                new String[]{"n = sizeof(a * b);",
                        "BINARY('=')[IDENTIFIER('n'), SIZEOF('sizeof')[PAREN('(')"
                                + "[BINARY('*')[IDENTIFIER('a'), IDENTIFIER('b')]]]]"},
                new String[]{"va_arg(ap, char *);", "CALL('(')[IDENTIFIER('va_arg'), IDENTIFIER('ap'), TYPE_NAME('char')]"}
        );
    }

    @ParameterizedTest
    @MethodSource("expressions")
    void parse_expression_shape(String statement, String expected) {
        assertEquals(expected, expr(statement));
    }

    @Test
    void parse_adjacent_strings_as_one_literal() {
        var p = parse("void f(void)\n{\n\tputs(\"a\" \"b\");\n}\n");
        var call = body(p.child(0)).child(0).child(0);
        var literal = call.child(1);
        assertEquals(NodeKind.LITERAL, literal.kind());
        assertEquals(2, literal.payload(Payload.StringPieces.class).pieces().size());
    }

    @Test
    void parse_statement_dispatch() {
        var parser = new Parser(new Lexer("""
                int f(int n)
                {
                	int i;
                	node_t *head;
                	x * y + 1;
                	for (i = 0, n = 1; i < n; i++, n--)
                		;
                	do
                		n--;
                	while (n);
                again:
                	goto again;
                }
                """).tokenize());
        var stmts = body(parser.parseProgram().child(0)).children();
        assertEquals(0, parser.errorCount());
        assertEquals(NodeKind.VAR_DECL, stmts.get(0).kind());
        assertEquals(NodeKind.VAR_DECL, stmts.get(1).kind());
        assertEquals(NodeKind.EXPR_STMT, stmts.get(2).kind());

        var loop = stmts.get(3);
        assertEquals(NodeKind.FOR, loop.kind());
        var clauses = loop.payload(Payload.ForClauses.class);
        assertEquals(2, clauses.initCount());
        assertTrue(clauses.hasCondition());
        assertEquals(2, clauses.updateCount());

        assertEquals(NodeKind.DO_WHILE, stmts.get(4).kind());
        assertEquals(NodeKind.LABEL, stmts.get(5).kind());
        assertEquals(NodeKind.GOTO, stmts.get(6).kind());
    }

    @Test
    void parse_switch_groups_statements_under_case() {
        var p = parse("void f(int n)\n{\n\tswitch (n)\n\t{\n\tcase 1:\n\t\tn++;\n\t\tbreak;\n\tdefault:\n\t\tbreak;\n\t}\n}\n");
        var sw = body(p.child(0)).child(0);
        assertEquals(NodeKind.SWITCH, sw.kind());
        var cases = sw.child(1).children();
        assertEquals(2, cases.size());
        assertEquals(3, cases.get(0).childCount(), "value plus two statements");
        assertEquals(1, cases.get(1).childCount());
    }

    @Test
    void parse_struct_members_and_bitfields() {
        var s = parse("struct flags\n{\n\tunsigned int a : 1, b : 3;\n\tstruct flags *next;\n\tint (*cb)(int);\n};").child(0);
        assertEquals(NodeKind.STRUCT, s.kind());
        assertEquals("flags", s.token().lexeme());
        assertEquals(3, s.childCount());

        var ds = s.child(0).payload(Payload.VarDeclInfo.class).declarators();
        assertEquals(2, ds.size());
        assertEquals(List.of("3"), lexemes(ds.get(1).bitWidth()));
        assertEquals(NodeKind.FUNC_PTR, s.child(2).kind());
    }

    @Test
    void parse_enum_values() {
        var e = parse("enum flags\n{\n\tA = 1 << 0,\n\tB = 2,\n\tC\n};").child(0);
        assertEquals(NodeKind.ENUM, e.kind());
        assertEquals(3, e.childCount());

        var a = e.child(0);
        assertEquals(NodeKind.UNPARSED, a.child(0).kind());
        assertEquals("1 << 0", a.child(0).payload(Payload.RawText.class).text());
        assertEquals("LITERAL('2')", e.child(1).child(0).toString());
        assertEquals(0, e.child(2).childCount());
    }

    @Test
    void parse_registers_tags_and_typedefs_in_given_scope() {
        var global = new SymbolTable();
        new Parser(new Lexer("typedef struct node { int v; } node_t;\nint count;").tokenize(), global).parseProgram();
        assertTrue(global.isTypedef("node_t"));
        assertEquals(SymbolKind.STRUCT, global.lookup("struct node").kind());
        assertEquals(SymbolKind.VARIABLE, global.lookup("count").kind());
    }

    @Test
    void member_names_stay_out_of_the_enclosing_scope() {
        var global = new SymbolTable();
        var parser = new Parser(new Lexer(
                "struct s { int count; void (*cb)(void); };\ntypedef int count;\n"
                        + "void f(void)\n{\n\tg((count)y);\n}\n").tokenize(), global);
        var p = parser.parseProgram();

        assertEquals(0, parser.errorCount());
        assertTrue(global.isTypedef("count"));
        assertNull(global.lookup("cb"));
        var call = body(p.child(2)).child(0).child(0);
        assertEquals("CALL('(')[IDENTIFIER('g'), CAST('(')[IDENTIFIER('y')]]", call.toString());
    }

    @Test
    void recover_unmodeled_top_level_construct() {
        String asm = "__asm__ volatile (\n    \"nop\"\n    :   :   : \"memory\");";
        var parser = new Parser(new Lexer("int x;\n" + asm + "\nint y;\n").tokenize());
        var p = parser.parseProgram();

        assertEquals(3, p.childCount());
        var raw = p.child(1);
        assertEquals(NodeKind.UNPARSED, raw.kind());
        var text = raw.payload(Payload.RawText.class);
        assertEquals(asm, text.text());
        assertEquals(2, text.startLine());
        assertEquals(4, text.endLine());
        assertEquals(7, text.startOffset());
        assertEquals(7 + asm.length(), text.endOffset());
        assertEquals(NodeKind.VAR_DECL, p.child(2).kind());
        assertEquals(1, parser.errorCount());
    }

    @Test
    void recover_statement_stops_at_semicolon() {
        var parser = new Parser(new Lexer("void f(void)\n{\n\ta = = 1;\n\treturn;\n}\n").tokenize());
        var stmts = body(parser.parseProgram().child(0)).children();
        assertEquals(2, stmts.size());
        assertEquals("a = = 1;", stmts.get(0).payload(Payload.RawText.class).text());
        assertEquals(NodeKind.RETURN, stmts.get(1).kind());
        assertEquals(1, parser.errorCount());
    }

    @Test
    void recover_stray_closing_brace() {
        var parser = new Parser(new Lexer("}\nint x;").tokenize());
        var p = parser.parseProgram();
        assertEquals(2, p.childCount());
        assertEquals("}", p.child(0).payload(Payload.RawText.class).text());
        assertEquals(NodeKind.VAR_DECL, p.child(1).kind());
    }

    @Test
    void recover_designated_initializer() {
        var parser = new Parser(new Lexer("struct point p = { .x = 1, .y = 2 };\nint z;").tokenize());
        var p = parser.parseProgram();
        assertEquals(NodeKind.UNPARSED, p.child(0).kind());
        assertEquals("struct point p = { .x = 1, .y = 2 };", p.child(0).payload(Payload.RawText.class).text());
        assertEquals(NodeKind.VAR_DECL, p.child(1).kind());
    }

    @Test
    void comments_attach_leading_trailing_and_dangling() {
        var p = parse("/* lead */\nint x; // tail\n\n\n/* end */\n");
        assertEquals(1, p.childCount());
        var decl = p.child(0);
        assertEquals("/* lead */", decl.leadingComments().get(0).token().lexeme());
        assertEquals("// tail", decl.trailingComments().get(0).lexeme());

        assertEquals(1, p.danglingComments().size());
        assertTrue(p.danglingComments().get(0).blankLineBefore());
    }

    @Test
    void blank_line_hint() {
        var p = parse("int a;\nint b;\n\n\nint c;\n");
        assertFalse(p.child(1).blankLineBefore());
        assertTrue(p.child(2).blankLineBefore());
    }

    @Test
    void parse_exception_names_the_offending_token() {
        var at = new Lexer("\n  }").tokenize().get(2);
        var e = new ParseException(at, "Expected expression");
        assertEquals("[2:3] Expected expression (got RBRACE '}')", e.getMessage());
        assertSame(at, e.token());
    }

    @Test
    void empty_input() {
        var p = parse("");
        assertEquals(NodeKind.PROGRAM, p.kind());
        assertEquals(0, p.childCount());
    }
}
