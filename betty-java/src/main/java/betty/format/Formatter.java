package betty.format;

import betty.ast.Comment;
import betty.ast.Node;
import betty.ast.NodeKind;
import betty.ast.Payload;
import betty.config.FormatterConfig;
import betty.lexer.Token;
import betty.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints an AST in Betty style: tab indentation, braces on their own line, one space
 * around binary operators, parenthesized return values and block comments.
 * Output depends only on the tree; unparsed regions are printed as they were.
 */
public final class Formatter {

    private final FormatterConfig config;
    private final StringBuilder out = new StringBuilder();
    private int indent = 0;
    // set at the start of a brace body, where no blank line may appear
    private boolean atBodyStart = true;

    public Formatter() {
        this(FormatterConfig.defaults());
    }

    public Formatter(FormatterConfig config) {
        this.config = config;
    }

    public String format(Node program) {
        out.setLength(0);
        indent = 0;
        atBodyStart = true;

        Node prev = null;
        for (Node item : program.children()) {
            emit(item, separated(prev, item));
            prev = item;
        }
        dangling(program);

        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') end--;
        return end == 0 ? "" : out.substring(0, end) + "\n";
    }

    // ---------- top-level layout ----------

    private static boolean separated(Node prev, Node cur) {
        if (prev == null) return false;
        if (isDefinition(prev) || isDefinition(cur)) return true;
        if (hasBody(prev)) return true;
        if (isVariable(prev) && !isVariable(cur)) return true;
        if (isPrototype(prev) && !isPrototype(cur)) return true;
        if (prev.is(NodeKind.PREPROCESSOR)) {
            return !cur.is(NodeKind.PREPROCESSOR) || directiveGroup(prev) != directiveGroup(cur);
        }
        return false;
    }

    private static boolean isDefinition(Node n) {
        return n.is(NodeKind.FUNCTION) && n.payload(Payload.FunctionInfo.class).definition();
    }

    private static boolean isPrototype(Node n) {
        return n.is(NodeKind.FUNCTION) && !n.payload(Payload.FunctionInfo.class).definition();
    }

    private static boolean isVariable(Node n) {
        return n.is(NodeKind.VAR_DECL) || n.is(NodeKind.FUNC_PTR);
    }

    private static boolean hasBody(Node n) {
        if (n.kind().isAggregate()) return n.payload(Payload.Aggregate.class).hasBody();
        if (n.is(NodeKind.TYPEDEF) || n.is(NodeKind.VAR_DECL)) {
            return n.childCount() > 0 && n.child(0).kind().isAggregate() && hasBody(n.child(0));
        }
        return false;
    }

    private static boolean isDeclaration(Node n) {
        return switch (n.kind()) {
            case VAR_DECL, FUNC_PTR, TYPEDEF, STRUCT, UNION, ENUM -> true;
            default -> false;
        };
    }

    /** 1 include, 2 define/undef, 3 conditional, 4 anything else. */
    static int directiveGroup(Node n) {
        String text = n.token().lexeme().substring(1).stripLeading();
        if (text.startsWith("include")) return 1;
        if (text.startsWith("define") || text.startsWith("undef")) return 2;
        if (text.startsWith("if") || text.startsWith("elif") || text.startsWith("else")
                || text.startsWith("endif")) return 3;
        return 4;
    }

    // ---------- emission ----------

    private void emit(Node n, boolean forcedBlank) {
        emit(n, forcedBlank, () -> statement(n));
    }

    private void emit(Node n, boolean forcedBlank, Runnable body) {
        boolean blank = forcedBlank;
        for (Comment c : n.leadingComments()) {
            if (blank || c.blankLineBefore()) blank();
            blank = false;
            line(comment(c.token()));
        }
        if (blank || n.blankLineBefore()) blank();
        body.run();
        // a case label carries its own comments on the label line
        if (!n.is(NodeKind.CASE)) trailing(n);
    }

    private void statement(Node n) {
        switch (n.kind()) {
            case PREPROCESSOR -> column0(n.token().lexeme().stripTrailing());
            case UNPARSED -> {
                String text = n.payload(Payload.RawText.class).text();
                if (!text.isEmpty()) line(text);
            }
            case FUNCTION -> function(n);
            case VAR_DECL -> varDecl(n);
            case FUNC_PTR -> line(funcPtr(n) + ";");
            case STRUCT, UNION, ENUM -> aggregate(n, "", ";");
            case TYPEDEF -> typedef(n);
            case BLOCK -> block(n);
            case IF -> ifStatement(n, "");
            case WHILE -> {
                line("while (" + expr(n.child(0)) + ")");
                body(n.child(1));
            }
            case FOR -> forStatement(n);
            case DO_WHILE -> doWhile(n);
            case SWITCH -> switchStatement(n);
            case CASE -> caseLabel(n);
            case RETURN -> line(returnText(n));
            case BREAK -> line("break;");
            case CONTINUE -> line("continue;");
            case GOTO -> line("goto " + n.token().lexeme() + ";");
            case LABEL -> column0(n.token().lexeme() + ":");
            case EXPR_STMT -> line(n.childCount() == 0 ? ";" : expr(n.child(0)) + ";");
            default -> line(expr(n) + ";");
        }
    }

    private void function(Node n) {
        Payload.FunctionInfo info = n.payload(Payload.FunctionInfo.class);
        List<String> params = new ArrayList<>();
        Node body = null;
        for (Node c : n.children()) {
            if (c.is(NodeKind.BLOCK)) body = c;
            else params.add(c.is(NodeKind.FUNC_PTR) ? funcPtr(c) : param(c));
        }

        StringBuilder sig = new StringBuilder(declarator(type(info.returnType()), info.pointer(), n.token().lexeme()));
        sig.append('(').append(String.join(", ", params)).append(')');
        if (!info.attributes().isEmpty()) sig.append(' ').append(TokenSpacing.join(info.attributes()));

        if (body == null) {
            line(sig + ";");
        } else {
            line(sig.toString());
            block(body);
        }
    }

    private String param(Node n) {
        if (n.token() != null && n.token().type() == TokenType.ELLIPSIS) return "...";
        Payload.ParamInfo info = n.payload(Payload.ParamInfo.class);
        String name = n.token() == null ? null : n.token().lexeme();
        return declarator(type(info.type()), info.pointer(), name) + TokenSpacing.join(info.array());
    }

    private void varDecl(Node n) {
        Payload.VarDeclInfo info = n.payload(Payload.VarDeclInfo.class);
        if (!info.inlineAggregate()) {
            line(declarationText(n) + ";");
            return;
        }
        String prefix = info.type().isEmpty() ? "" : type(info.type()) + " ";
        aggregate(n.child(0), prefix, " " + declarators(info, n.children().subList(1, n.childCount())) + ";");
    }

    /** A declaration without its semicolon, as used in {@code for} clauses. */
    private String declarationText(Node n) {
        if (n.is(NodeKind.FUNC_PTR)) return funcPtr(n);
        Payload.VarDeclInfo info = n.payload(Payload.VarDeclInfo.class);
        return type(info.type()) + " " + declarators(info, n.children());
    }

    private String declarators(Payload.VarDeclInfo info, List<Node> initializers) {
        List<String> parts = new ArrayList<>();
        int next = 0;
        for (Payload.Declarator d : info.declarators()) {
            StringBuilder sb = new StringBuilder(pointer(d.pointer()));
            sb.append(d.name().lexeme()).append(TokenSpacing.join(d.array()));
            if (!d.bitWidth().isEmpty()) sb.append(" : ").append(TokenSpacing.join(d.bitWidth()));
            if (d.initialized()) sb.append(" = ").append(expr(initializers.get(next++)));
            parts.add(sb.toString());
        }
        return String.join(", ", parts);
    }

    private String funcPtr(Node n) {
        Payload.FuncPtrInfo info = n.payload(Payload.FuncPtrInfo.class);
        String text = type(info.returnType()) + " " + pointer(info.pointer())
                + "(*" + info.name().lexeme() + ")(" + TokenSpacing.join(info.params(), true) + ")";
        return n.childCount() > 0 ? text + " = " + expr(n.child(0)) : text;
    }

    private void typedef(Node n) {
        Payload.TypedefInfo info = n.payload(Payload.TypedefInfo.class);
        if (n.childCount() > 0 && n.child(0).is(NodeKind.FUNC_PTR)) {
            line("typedef " + funcPtr(n.child(0)) + ";");
            return;
        }
        String alias = pointer(info.pointer()) + info.alias().lexeme() + TokenSpacing.join(info.array());
        if (n.childCount() > 0) {
            String prefix = info.baseType().isEmpty() ? "typedef " : "typedef " + type(info.baseType()) + " ";
            aggregate(n.child(0), prefix, " " + alias + ";");
        } else {
            line("typedef " + type(info.baseType()) + " " + alias + ";");
        }
    }

    /** Prints {@code prefix keyword tag}, the braced body, then {@code }} plus {@code suffix}. */
    private void aggregate(Node n, String prefix, String suffix) {
        Payload.Aggregate info = n.payload(Payload.Aggregate.class);
        String header = prefix + info.keyword().lexeme() + (n.token() == null ? "" : " " + n.token().lexeme());
        if (!info.hasBody()) {
            line(header + suffix);
            return;
        }
        line(header);
        line("{");
        open();
        if (n.is(NodeKind.ENUM)) {
            enumEntries(n.children());
        } else {
            for (Node member : n.children()) emit(member, false);
        }
        dangling(n);
        close("}" + suffix);
    }

    private void enumEntries(List<Node> entries) {
        int last = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (!entries.get(i).is(NodeKind.PREPROCESSOR)) last = i;
        }
        for (int i = 0; i < entries.size(); i++) {
            Node e = entries.get(i);
            if (e.is(NodeKind.PREPROCESSOR)) {
                emit(e, false);
                continue;
            }
            String text = e.is(NodeKind.ENUM_VALUE)
                    ? e.token().lexeme() + (e.childCount() > 0 ? " = " + expr(e.child(0)) : "")
                    : e.payload(Payload.RawText.class).text();
            String comma = i < last ? "," : "";
            emit(e, false, () -> line(text + comma));
        }
    }

    private void block(Node n) {
        line("{");
        open();
        List<Node> items = n.children();
        boolean leadingDeclarations = true;
        for (int i = 0; i < items.size(); i++) {
            Node s = items.get(i);
            boolean forced = i > 0 && leadingDeclarations && !isDeclaration(s);
            if (!isDeclaration(s)) leadingDeclarations = false;
            emit(s, forced);
        }
        dangling(n);
        close("}");
    }

    // body of if/while/for: a block stays at this level, anything else goes one deeper
    private void body(Node n) {
        atBodyStart = true;
        if (n.is(NodeKind.BLOCK)) {
            emit(n, false);
            return;
        }
        indent++;
        emit(n, false);
        indent--;
    }

    private void ifStatement(Node n, String prefix) {
        line(prefix + "if (" + expr(n.child(0)) + ")");
        body(n.child(1));
        if (n.childCount() < 3) return;

        Node otherwise = n.child(2);
        if (otherwise.is(NodeKind.IF) && otherwise.leadingComments().isEmpty()) {
            ifStatement(otherwise, "else ");
            trailing(otherwise);
        } else {
            line("else");
            body(otherwise);
        }
    }

    private void forStatement(Node n) {
        Payload.ForClauses clauses = n.payload(Payload.ForClauses.class);
        List<Node> c = n.children();
        int i = 0;

        List<String> init = new ArrayList<>();
        for (int k = 0; k < clauses.initCount(); k++, i++) {
            Node part = c.get(i);
            init.add(isDeclaration(part) ? declarationText(part) : expr(part));
        }
        String cond = clauses.hasCondition() ? expr(c.get(i++)) : "";
        List<String> update = new ArrayList<>();
        for (int k = 0; k < clauses.updateCount(); k++, i++) update.add(expr(c.get(i)));

        StringBuilder sb = new StringBuilder("for (").append(String.join(", ", init)).append(';');
        if (!cond.isEmpty()) sb.append(' ').append(cond);
        sb.append(';');
        if (!update.isEmpty()) sb.append(' ').append(String.join(", ", update));
        sb.append(')');
        line(sb.toString());
        body(c.get(i));
    }

    private void doWhile(Node n) {
        Node body = n.child(0);
        String tail = "while (" + expr(n.child(1)) + ");";
        if (!body.is(NodeKind.BLOCK)) {
            line("do");
            body(body);
            line(tail);
            return;
        }
        line("do {");
        open();
        for (Comment c : body.leadingComments()) line(comment(c.token()));
        for (Node s : body.children()) emit(s, false);
        dangling(body);
        close("} " + tail);
        if (!body.trailingComments().isEmpty()) trailing(body);
    }

    private void switchStatement(Node n) {
        line("switch (" + expr(n.child(0)) + ")");
        Node body = n.child(1);
        if (!body.is(NodeKind.BLOCK)) {
            body(body);
            return;
        }
        for (Comment c : body.leadingComments()) line(comment(c.token()));
        line("{");
        atBodyStart = true;
        for (Node s : body.children()) emit(s, false);
        dangling(body);
        line("}");
        trailing(body);
    }

    private void caseLabel(Node n) {
        boolean hasValue = n.token().type() == TokenType.CASE;
        line(hasValue ? "case " + expr(n.child(0)) + ":" : "default:");
        trailing(n);
        indent++;
        atBodyStart = true;
        for (Node s : n.children().subList(hasValue ? 1 : 0, n.childCount())) emit(s, false);
        indent--;
    }

    private String returnText(Node n) {
        if (n.childCount() == 0) return "return;";
        Node value = n.child(0);
        return value.is(NodeKind.PAREN) ? "return " + expr(value) + ";" : "return (" + expr(value) + ");";
    }

    // ---------- expressions ----------

    private String expr(Node n) {
        return switch (n.kind()) {
            case LITERAL -> n.hasPayload()
                    ? joinLexemes(n.payload(Payload.StringPieces.class).pieces())
                    : n.token().lexeme();
            case IDENTIFIER -> n.token().lexeme();
            case BINARY -> expr(n.child(0)) + " " + n.token().lexeme() + " " + expr(n.child(1));
            case UNARY -> unaryText(n);
            case TERNARY -> expr(n.child(0)) + " ? " + expr(n.child(1)) + " : " + expr(n.child(2));
            case CALL -> {
                List<String> args = new ArrayList<>();
                for (Node a : n.children().subList(1, n.childCount())) args.add(expr(a));
                yield expr(n.child(0)) + "(" + String.join(", ", args) + ")";
            }
            case ARRAY_ACCESS -> expr(n.child(0)) + "[" + expr(n.child(1)) + "]";
            case MEMBER_ACCESS -> expr(n.child(0))
                    + (n.payload(Payload.Member.class).arrow() ? "->" : ".") + n.token().lexeme();
            case CAST -> "(" + typeName(n.payload(Payload.TypeName.class)) + ")" + expr(n.child(0));
            case SIZEOF -> {
                if (n.childCount() == 0) yield "sizeof(" + typeName(n.payload(Payload.TypeName.class)) + ")";
                Node operand = n.child(0);
                yield operand.is(NodeKind.PAREN) ? "sizeof" + expr(operand) : "sizeof " + expr(operand);
            }
            case PAREN -> "(" + expr(n.child(0)) + ")";
            case TYPE_NAME -> typeName(n.payload(Payload.TypeName.class));
            case INIT_LIST -> {
                List<String> items = new ArrayList<>();
                for (Node c : n.children()) items.add(expr(c));
                yield "{" + String.join(", ", items) + "}";
            }
            case UNPARSED -> n.payload(Payload.RawText.class).text();
            default -> throw new IllegalStateException("Not an expression: " + n.kind());
        };
    }

    private String unaryText(Node n) {
        String op = n.token().lexeme();
        String operand = expr(n.child(0));
        if (n.payload(Payload.Unary.class).postfix()) return operand + op;
        TokenType first = n.child(0).is(NodeKind.UNARY) && !n.child(0).payload(Payload.Unary.class).postfix()
                ? n.child(0).token().type()
                : null;
        return first != null && TokenSpacing.fuses(n.token().type(), first) ? op + " " + operand : op + operand;
    }

    private String typeName(Payload.TypeName t) {
        return (type(t.type()) + " " + pointer(t.pointer())).stripTrailing();
    }

    // ---------- declarator pieces ----------

    private static String type(List<Token> tokens) {
        return TokenSpacing.join(tokens, true);
    }

    /** Stars bind to the name: {@code char *const *p}. */
    private static String pointer(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (t.type() == TokenType.STAR) sb.append('*');
            else if (t.type() == TokenType.CONST || t.type() == TokenType.VOLATILE) sb.append(t.lexeme()).append(' ');
            else sb.append(t.lexeme());
        }
        return sb.toString();
    }

    private static String declarator(String type, List<Token> pointer, String name) {
        if (name == null) return (type + " " + pointer(pointer)).stripTrailing();
        return type + " " + pointer(pointer) + name;
    }

    private static String joinLexemes(List<Token> tokens) {
        List<String> parts = new ArrayList<>();
        for (Token t : tokens) parts.add(t.lexeme());
        return String.join(" ", parts);
    }

    // ---------- comments ----------

    private String comment(Token t) {
        return CommentText.render(t, config.convertLineComments());
    }

    private void trailing(Node n) {
        if (n.trailingComments().isEmpty() || out.length() == 0) return;
        out.setLength(out.length() - 1);
        for (Token t : n.trailingComments()) out.append(' ').append(comment(t));
        out.append('\n');
    }

    private void dangling(Node n) {
        for (Comment c : n.danglingComments()) {
            if (c.blankLineBefore()) blank();
            line(comment(c.token()));
        }
    }

    // ---------- output ----------

    private void open() {
        indent++;
        atBodyStart = true;
    }

    private void close(String text) {
        indent--;
        line(text);
    }

    private void line(String text) {
        out.append("\t".repeat(indent)).append(text).append('\n');
        atBodyStart = false;
    }

    private void column0(String text) {
        out.append(text).append('\n');
        atBodyStart = false;
    }

    private void blank() {
        if (atBodyStart || out.length() == 0) return;
        if (out.length() >= 2 && out.charAt(out.length() - 1) == '\n' && out.charAt(out.length() - 2) == '\n') return;
        out.append('\n');
    }
}
