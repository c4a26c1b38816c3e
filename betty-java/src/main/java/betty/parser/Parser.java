package betty.parser;

import betty.ast.Comment;
import betty.ast.Node;
import betty.ast.NodeKind;
import betty.ast.Payload;
import betty.lexer.Token;
import betty.lexer.TokenType;
import betty.sema.SymbolKind;
import betty.sema.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static betty.lexer.TokenType.*;

/**
 * Recursive-descent parser for the subset of C the formatter models.
 * <p>
 * The cursor walks the full token list, trivia included. Comments met while skipping are
 * buffered and attached to the next node (leading) or to the node that ends on the same
 * line (trailing). Any declaration, statement, member or enum entry that does not parse is
 * captured verbatim as an {@code UNPARSED} node, so {@link #parseProgram()} never fails.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> BASE_TYPES = EnumSet.of(
            VOID, CHAR, SHORT, INT, LONG, FLOAT, DOUBLE, SIGNED, UNSIGNED);

    private static final Set<TokenType> QUALIFIERS = EnumSet.of(
            CONST, VOLATILE, STATIC, EXTERN, AUTO, REGISTER, INLINE);

    private static final Set<TokenType> AGGREGATES = EnumSet.of(STRUCT, UNION, ENUM);

    // tokens that may appear inside a parenthesized type name
    private static final Set<TokenType> TYPE_TOKENS = EnumSet.of(
            IDENTIFIER, STAR, CONST, VOLATILE, UNSIGNED, SIGNED, SHORT, LONG, INT, VOID, CHAR,
            FLOAT, DOUBLE, STRUCT, ENUM, UNION, STATIC, EXTERN, REGISTER, AUTO,
            LBRACKET, RBRACKET, INT_LITERAL);

    private enum Recovery { TOP_LEVEL, STATEMENT, ENUM_ENTRY }

    private record Leading(List<Comment> comments, boolean blankLineBefore) {}

    private record Checkpoint(int pos, int pending, int errors, Token last) {}

    private record Specifiers(List<Token> tokens, Node aggregate) {
        boolean isEmpty() { return tokens.isEmpty() && aggregate == null; }
    }

    private final List<Token> tokens;
    private int pos = 0;
    private SymbolTable symbols;

    // comments skipped inside a construct, not yet attached to a node
    private final List<Token> pending = new ArrayList<>();
    private Token lastConsumed;
    private int errorCount = 0;

    public Parser(List<Token> tokens) {
        this(tokens, SymbolTable.withStandardTypedefs());
    }

    public Parser(List<Token> tokens, SymbolTable symbols) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != EOF) {
            List<Token> copy = new ArrayList<>(tokens);
            int offset = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).endOffset();
            copy.add(new Token(EOF, "", 0, 0, offset));
            tokens = copy;
        }
        this.tokens = tokens;
        this.symbols = symbols;
    }

    /** Number of regions that had to be kept verbatim. */
    public int errorCount() {
        return errorCount;
    }

    // ---------- entry ----------
    public Node parseProgram() {
        Node program = new Node(NodeKind.PROGRAM, null);
        while (true) {
            Leading lead = collectLeading();
            if (check(EOF)) {
                program.danglingComments().addAll(lead.comments());
                break;
            }
            program.add(item(lead, this::external, Recovery.TOP_LEVEL));
        }
        return program;
    }

    private Node item(Supplier<Node> production, Recovery recovery) {
        return item(collectLeading(), production, recovery);
    }

    private Node item(Leading lead, Supplier<Node> production, Recovery recovery) {
        Checkpoint cp = checkpoint();
        Node n;
        try {
            n = production.get();
        } catch (ParseException e) {
            restore(cp);
            n = recover(recovery, e);
        }
        n.leadingComments().addAll(lead.comments());
        n.setBlankLineBefore(lead.blankLineBefore());
        attachTrailing(n);
        return n;
    }

    // ---------- top level ----------
    private Node external() {
        Token t = peek();
        if (t.type() == PREPROCESSOR) return new Node(NodeKind.PREPROCESSOR, advance());
        if (t.type() == TYPEDEF) return typedefDeclaration();
        if (AGGREGATES.contains(t.type()) && aggregateBodyAhead()) return declaration(false);

        Checkpoint cp = checkpoint();
        try {
            return function();
        } catch (ParseException e) {
            restore(cp);
        }
        return declaration(false);
    }

    // ---------- function ----------
    private Node function() {
        Specifiers spec = declSpecifiers();
        if (spec.tokens().isEmpty() || spec.aggregate() != null) {
            throw error(peek(), "Expected return type");
        }
        List<Token> pointer = pointer();
        Token name = consume(IDENTIFIER, "Expected function name");
        consume(LPAREN, "Expected '(' after function name");

        SymbolTable outer = symbols;
        symbols = new SymbolTable(outer);
        Node fn;
        try {
            List<Node> params = parameters();
            List<Token> attributes = attributes();
            Node body = null;
            if (!match(SEMICOLON)) {
                if (!check(LBRACE)) throw error(peek(), "Expected ';' or function body");
                body = block(false);
            }
            fn = new Node(NodeKind.FUNCTION, name,
                    new Payload.FunctionInfo(spec.tokens(), pointer, attributes, body != null));
            params.forEach(fn::add);
            if (body != null) fn.add(body);
        } finally {
            symbols = outer;
        }
        symbols.add(name.lexeme(), SymbolKind.FUNCTION);
        return fn;
    }

    private List<Node> parameters() {
        List<Node> params = new ArrayList<>();
        if (match(RPAREN)) return params;
        do {
            if (check(ELLIPSIS)) {
                params.add(new Node(NodeKind.PARAM, advance(),
                        new Payload.ParamInfo(List.of(), List.of(), List.of())));
            } else {
                params.add(parameter());
            }
        } while (match(COMMA));
        consume(RPAREN, "Expected ')' after parameters");
        return params;
    }

    private Node parameter() {
        Specifiers spec = declSpecifiers();
        if (spec.tokens().isEmpty() || spec.aggregate() != null) throw error(peek(), "Expected parameter type");
        List<Token> pointer = pointer();
        if (functionPointerAhead()) {
            Node fp = functionPointer(spec.tokens(), pointer);
            symbols.add(fp.token().lexeme(), SymbolKind.VARIABLE);
            return fp;
        }
        Token name = check(IDENTIFIER) ? advance() : null;
        List<Token> array = arrayDimensions();
        if (name != null) symbols.add(name.lexeme(), SymbolKind.VARIABLE);
        return new Node(NodeKind.PARAM, name, new Payload.ParamInfo(spec.tokens(), pointer, array));
    }

    // GNU __attribute__((...)) lists after a declarator
    private List<Token> attributes() {
        List<Token> out = new ArrayList<>();
        while (check(IDENTIFIER) && peek().lexeme().startsWith("__attribute")) {
            out.add(advance());
            if (!check(LPAREN)) throw error(peek(), "Expected '(' after __attribute__");
            out.addAll(balanced(LPAREN, RPAREN));
        }
        return out;
    }

    // ---------- declarations ----------
    private Specifiers declSpecifiers() {
        List<Token> out = new ArrayList<>();
        Node aggregate = null;
        boolean base = false;
        while (true) {
            Token t = peek();
            if (QUALIFIERS.contains(t.type())) {
                out.add(advance());
            } else if (BASE_TYPES.contains(t.type())) {
                out.add(advance());
                base = true;
            } else if (AGGREGATES.contains(t.type()) && !base) {
                if (aggregateBodyAhead()) {
                    aggregate = aggregate();
                } else {
                    out.add(advance());
                    out.add(consume(IDENTIFIER, "Expected tag name after '" + t.lexeme() + "'"));
                }
                base = true;
            } else if (t.type() == IDENTIFIER && !base && identifierNamesType()) {
                out.add(advance());
                base = true;
            } else {
                break;
            }
        }
        return new Specifiers(out, aggregate);
    }

    // at an identifier in specifier position: typedef name, or followed by a declarator name
    private boolean identifierNamesType() {
        if (symbols.isTypedef(peek().lexeme())) return true;
        int i = 1;
        while (checkAt(i, STAR)) i++;
        return checkAt(i, IDENTIFIER);
    }

    private List<Token> pointer() {
        List<Token> out = new ArrayList<>();
        while (check(STAR)) {
            out.add(advance());
            while (check(CONST) || check(VOLATILE)) out.add(advance());
        }
        return out;
    }

    private List<Token> arrayDimensions() {
        List<Token> out = new ArrayList<>();
        while (check(LBRACKET)) out.addAll(balanced(LBRACKET, RBRACKET));
        return out;
    }

    private boolean functionPointerAhead() {
        return check(LPAREN) && checkAt(1, STAR);
    }

    private Node functionPointer(List<Token> returnType, List<Token> returnPointer) {
        consume(LPAREN, "Expected '('");
        consume(STAR, "Expected '*'");
        Token name = consume(IDENTIFIER, "Expected function pointer name");
        consume(RPAREN, "Expected ')' after function pointer name");
        if (!check(LPAREN)) throw error(peek(), "Expected parameter list");
        List<Token> params = balanced(LPAREN, RPAREN);
        params = params.subList(1, params.size() - 1);
        return new Node(NodeKind.FUNC_PTR, name,
                new Payload.FuncPtrInfo(returnType, returnPointer, name, List.copyOf(params)));
    }

    /**
     * Variable declaration, struct member, or a standalone struct/union/enum definition,
     * through the closing {@code ;}.
     */
    private Node declaration(boolean member) {
        Specifiers spec = declSpecifiers();
        if (spec.isEmpty()) throw error(peek(), "Expected declaration");

        if (check(SEMICOLON) && spec.aggregate() != null && spec.tokens().isEmpty()) {
            advance();
            declareTag(spec.aggregate());
            return spec.aggregate();
        }
        if (check(SEMICOLON) && spec.aggregate() == null && spec.tokens().size() == 2
                && AGGREGATES.contains(spec.tokens().get(0).type())) {
            advance();
            Token keyword = spec.tokens().get(0);
            return new Node(aggregateKind(keyword), spec.tokens().get(1), new Payload.Aggregate(keyword, false));
        }

        List<Token> pointer = pointer();
        if (functionPointerAhead()) {
            Node fp = functionPointer(spec.tokens(), pointer);
            if (match(ASSIGN)) fp.add(initializer());
            consume(SEMICOLON, "Expected ';' after declaration");
            if (!member) symbols.add(fp.token().lexeme(), SymbolKind.VARIABLE);
            return fp;
        }

        List<Payload.Declarator> declarators = new ArrayList<>();
        List<Node> initializers = new ArrayList<>();
        while (true) {
            if (!declarators.isEmpty()) pointer = pointer();
            Token name = consume(IDENTIFIER, "Expected declarator name");
            List<Token> array = arrayDimensions();
            List<Token> width = List.of();
            if (member && check(COLON)) {
                advance();
                width = bitWidth();
            }
            boolean initialized = false;
            if (match(ASSIGN)) {
                initializers.add(initializer());
                initialized = true;
            }
            declarators.add(new Payload.Declarator(pointer, name, array, width, initialized));
            if (!match(COMMA)) break;
        }
        consume(SEMICOLON, "Expected ';' after declaration");

        // members live in their aggregate's namespace
        if (!member) {
            for (Payload.Declarator d : declarators) symbols.add(d.name().lexeme(), SymbolKind.VARIABLE);
        }
        declareTag(spec.aggregate());

        Node decl = new Node(NodeKind.VAR_DECL, declarators.get(0).name(),
                new Payload.VarDeclInfo(spec.tokens(), declarators, spec.aggregate() != null));
        if (spec.aggregate() != null) decl.add(spec.aggregate());
        initializers.forEach(decl::add);
        return decl;
    }

    private List<Token> bitWidth() {
        List<Token> out = new ArrayList<>();
        while (!check(COMMA) && !check(SEMICOLON) && !check(EOF) && !check(ASSIGN)) {
            if (check(LPAREN)) out.addAll(balanced(LPAREN, RPAREN));
            else out.add(advance());
        }
        if (out.isEmpty()) throw error(peek(), "Expected bit-field width");
        return out;
    }

    private Node typedefDeclaration() {
        consume(TYPEDEF, "Expected 'typedef'");
        Specifiers spec = declSpecifiers();
        if (spec.isEmpty()) throw error(peek(), "Expected type after 'typedef'");
        List<Token> pointer = pointer();

        Node typedef;
        if (functionPointerAhead()) {
            Node fp = functionPointer(spec.tokens(), pointer);
            consume(SEMICOLON, "Expected ';' after typedef");
            typedef = new Node(NodeKind.TYPEDEF, fp.token(),
                    new Payload.TypedefInfo(List.of(), List.of(), fp.token(), List.of()));
            typedef.add(fp);
        } else {
            Token alias = consume(IDENTIFIER, "Expected typedef name");
            List<Token> array = arrayDimensions();
            consume(SEMICOLON, "Expected ';' after typedef");
            typedef = new Node(NodeKind.TYPEDEF, alias,
                    new Payload.TypedefInfo(spec.tokens(), pointer, alias, array));
            if (spec.aggregate() != null) typedef.add(spec.aggregate());
        }
        symbols.add(typedef.token().lexeme(), SymbolKind.TYPEDEF);
        declareTag(spec.aggregate());
        return typedef;
    }

    private void declareTag(Node aggregate) {
        if (aggregate == null || aggregate.token() == null) return;
        symbols.addTag(tagKind(aggregate.kind()), aggregate.token().lexeme());
    }

    // ---------- struct / union / enum ----------
    private boolean aggregateBodyAhead() {
        if (checkAt(1, LBRACE)) return true;
        return checkAt(1, IDENTIFIER) && checkAt(2, LBRACE);
    }

    private Node aggregate() {
        Token keyword = advance();
        Token tag = check(IDENTIFIER) ? advance() : null;
        NodeKind kind = aggregateKind(keyword);
        consume(LBRACE, "Expected '{'");

        Node agg = new Node(kind, tag, new Payload.Aggregate(keyword, true));
        if (kind == NodeKind.ENUM) {
            while (!check(RBRACE) && !check(EOF)) {
                agg.add(item(this::enumEntry, Recovery.ENUM_ENTRY));
                if (agg.child(agg.childCount() - 1).is(NodeKind.UNPARSED)) match(COMMA);
            }
        } else {
            while (!check(RBRACE) && !check(EOF)) {
                agg.add(item(this::member, Recovery.STATEMENT));
            }
        }
        agg.danglingComments().addAll(collectLeading().comments());
        consume(RBRACE, "Expected '}'");
        return agg;
    }

    private Node member() {
        if (check(PREPROCESSOR)) return new Node(NodeKind.PREPROCESSOR, advance());
        return declaration(true);
    }

    private Node enumEntry() {
        if (check(PREPROCESSOR)) return new Node(NodeKind.PREPROCESSOR, advance());
        Token name = consume(IDENTIFIER, "Expected enumerator name");
        Node entry = new Node(NodeKind.ENUM_VALUE, name);
        if (match(ASSIGN)) entry.add(enumValue());
        if (!match(COMMA) && !check(RBRACE)) throw error(peek(), "Expected ',' or '}' after enumerator");
        symbols.add(name.lexeme(), SymbolKind.VARIABLE);
        return entry;
    }

    // literal or identifier values are kept as nodes; anything else as its source text
    private Node enumValue() {
        Token t = peek();
        boolean simple = t.type() == INT_LITERAL || t.type() == CHAR_LITERAL || t.type() == IDENTIFIER;
        if (simple && (checkAt(1, COMMA) || checkAt(1, RBRACE))) {
            advance();
            return new Node(t.type() == IDENTIFIER ? NodeKind.IDENTIFIER : NodeKind.LITERAL, t);
        }

        int start = significant(pos);
        int end = start;
        int comments = pending.size();
        int depth = 0;
        while (!check(EOF)) {
            TokenType type = peek().type();
            if (depth == 0 && (type == COMMA || type == RBRACE)) break;
            if (type == LPAREN || type == LBRACKET || type == LBRACE) depth++;
            if ((type == RPAREN || type == RBRACKET || type == RBRACE) && depth > 0) depth--;
            advance();
            end = pos;
        }
        if (end == start) throw error(peek(), "Expected enumerator value");
        // comments inside the value are part of its text
        pending.subList(comments, pending.size()).clear();
        return raw(start, end);
    }

    // ---------- statements ----------
    private Node block(boolean newScope) {
        Token lbrace = consume(LBRACE, "Expected '{'");
        SymbolTable outer = symbols;
        if (newScope) symbols = new SymbolTable(outer);
        try {
            Node block = new Node(NodeKind.BLOCK, lbrace);
            while (!check(RBRACE) && !check(EOF)) {
                block.add(item(this::statement, Recovery.STATEMENT));
            }
            block.danglingComments().addAll(collectLeading().comments());
            consume(RBRACE, "Expected '}'");
            return block;
        } finally {
            symbols = outer;
        }
    }

    private Node statement() {
        Token t = peek();
        return switch (t.type()) {
            case LBRACE -> block(true);
            case IF -> ifStatement();
            case WHILE -> whileStatement();
            case FOR -> forStatement();
            case DO -> doWhileStatement();
            case SWITCH -> switchStatement();
            case CASE, DEFAULT -> caseLabel();
            case RETURN -> returnStatement();
            case BREAK, CONTINUE -> {
                advance();
                consume(SEMICOLON, "Expected ';' after '" + t.lexeme() + "'");
                yield new Node(t.type() == BREAK ? NodeKind.BREAK : NodeKind.CONTINUE, t);
            }
            case GOTO -> {
                advance();
                Token label = consume(IDENTIFIER, "Expected label after 'goto'");
                consume(SEMICOLON, "Expected ';' after goto");
                yield new Node(NodeKind.GOTO, label);
            }
            case TYPEDEF -> typedefDeclaration();
            case STRUCT, UNION, ENUM -> declaration(false);
            case PREPROCESSOR -> new Node(NodeKind.PREPROCESSOR, advance());
            case SEMICOLON -> new Node(NodeKind.EXPR_STMT, advance());
            default -> {
                if (t.type() == IDENTIFIER && checkAt(1, COLON)) {
                    advance();
                    advance();
                    yield new Node(NodeKind.LABEL, t);
                }
                if (declarationAhead()) yield declaration(false);
                yield expressionStatement();
            }
        };
    }

    /**
     * A declaration starts with a type keyword, a typedef name, or matches
     * {@code IDENT *... IDENT} followed by one of {@code ; , = [}.
     */
    private boolean declarationAhead() {
        Token t = peek();
        if (BASE_TYPES.contains(t.type()) || QUALIFIERS.contains(t.type()) || AGGREGATES.contains(t.type())) {
            return true;
        }
        if (t.type() != IDENTIFIER) return false;
        if (symbols.isTypedef(t.lexeme())) return true;

        int i = 1;
        while (checkAt(i, STAR)) i++;
        if (!checkAt(i, IDENTIFIER)) return false;
        TokenType after = peekAt(i + 1).type();
        return after == SEMICOLON || after == COMMA || after == ASSIGN || after == LBRACKET;
    }

    private Node ifStatement() {
        Token kw = advance();
        Node cond = condition();
        Node n = new Node(NodeKind.IF, kw).add(cond).add(item(this::statement, Recovery.STATEMENT));
        if (check(ELSE)) {
            advance();
            n.add(item(this::statement, Recovery.STATEMENT));
        }
        return n;
    }

    private Node whileStatement() {
        Token kw = advance();
        Node cond = condition();
        return new Node(NodeKind.WHILE, kw).add(cond).add(item(this::statement, Recovery.STATEMENT));
    }

    private Node doWhileStatement() {
        Token kw = advance();
        Node body = item(this::statement, Recovery.STATEMENT);
        consume(WHILE, "Expected 'while' after do body");
        Node cond = condition();
        consume(SEMICOLON, "Expected ';' after do-while");
        return new Node(NodeKind.DO_WHILE, kw).add(body).add(cond);
    }

    private Node condition() {
        consume(LPAREN, "Expected '('");
        Node cond = expression();
        consume(RPAREN, "Expected ')'");
        return cond;
    }

    private Node forStatement() {
        Token kw = advance();
        consume(LPAREN, "Expected '(' after 'for'");

        SymbolTable outer = symbols;
        symbols = new SymbolTable(outer);
        try {
            List<Node> init = new ArrayList<>();
            if (match(SEMICOLON)) {
                // empty
            } else if (declarationAhead()) {
                init.add(declaration(false));
            } else {
                init = expressionList();
                consume(SEMICOLON, "Expected ';' after for initializer");
            }

            Node cond = check(SEMICOLON) ? null : expression();
            consume(SEMICOLON, "Expected ';' after for condition");

            List<Node> update = check(RPAREN) ? List.of() : expressionList();
            consume(RPAREN, "Expected ')' after for clauses");

            Node body = item(this::statement, Recovery.STATEMENT);

            Node n = new Node(NodeKind.FOR, kw,
                    new Payload.ForClauses(init.size(), cond != null, update.size()));
            init.forEach(n::add);
            if (cond != null) n.add(cond);
            update.forEach(n::add);
            return n.add(body);
        } finally {
            symbols = outer;
        }
    }

    private List<Node> expressionList() {
        List<Node> out = new ArrayList<>();
        do {
            out.add(expression());
        } while (match(COMMA));
        return out;
    }

    private Node switchStatement() {
        Token kw = advance();
        Node n = new Node(NodeKind.SWITCH, kw).add(condition());
        if (!check(LBRACE)) return n.add(item(this::statement, Recovery.STATEMENT));

        Token lbrace = advance();
        SymbolTable outer = symbols;
        symbols = new SymbolTable(outer);
        try {
            Node body = new Node(NodeKind.BLOCK, lbrace);
            Node current = null;
            while (!check(RBRACE) && !check(EOF)) {
                Node stmt = item(this::statement, Recovery.STATEMENT);
                if (stmt.is(NodeKind.CASE)) {
                    body.add(stmt);
                    current = stmt;
                } else if (current != null) {
                    current.add(stmt);
                } else {
                    body.add(stmt);
                }
            }
            body.danglingComments().addAll(collectLeading().comments());
            consume(RBRACE, "Expected '}' after switch body");
            return n.add(body);
        } finally {
            symbols = outer;
        }
    }

    // children: the value for 'case', then (inside a switch body) the statements it labels
    private Node caseLabel() {
        Token kw = advance();
        Node n = new Node(NodeKind.CASE, kw);
        if (kw.type() == CASE) n.add(expression());
        consume(COLON, "Expected ':' after case label");
        return n;
    }

    private Node returnStatement() {
        Token kw = advance();
        Node n = new Node(NodeKind.RETURN, kw);
        if (!check(SEMICOLON)) n.add(expression());
        consume(SEMICOLON, "Expected ';' after return");
        return n;
    }

    private Node expressionStatement() {
        Node e = expression();
        consume(SEMICOLON, "Expected ';' after expression");
        return new Node(NodeKind.EXPR_STMT, null).add(e);
    }

    // ---------- initializers ----------
    private Node initializer() {
        return check(LBRACE) ? initList() : expression();
    }

    private Node initList() {
        Token lbrace = advance();
        Node list = new Node(NodeKind.INIT_LIST, lbrace);
        while (!check(RBRACE)) {
            list.add(initializer());
            if (!match(COMMA)) break;
        }
        consume(RBRACE, "Expected '}' after initializer list");
        return list;
    }

    // ---------- expressions ----------
    private Node expression() {
        return binary(1);
    }

    private Node binary(int minPrecedence) {
        Node left = unary();
        while (true) {
            Token op = peek();
            if (op.type() == QUESTION && minPrecedence <= 1) {
                advance();
                Node then = expression();
                consume(COLON, "Expected ':' in conditional expression");
                Node otherwise = binary(minPrecedence);
                left = new Node(NodeKind.TERNARY, op).add(left).add(then).add(otherwise);
                continue;
            }
            int prec = precedence(op.type());
            if (prec < 0 || prec < minPrecedence) break;
            advance();
            Node right = op.type().isAssignment() ? binary(prec) : binary(prec + 1);
            left = new Node(NodeKind.BINARY, op).add(left).add(right);
        }
        return left;
    }

    private Node unary() {
        Token t = peek();
        switch (t.type()) {
            case NOT, TILDE, PLUS, MINUS, STAR, AMP, INCREMENT, DECREMENT -> {
                advance();
                return new Node(NodeKind.UNARY, t, new Payload.Unary(false)).add(unary());
            }
            case SIZEOF -> {
                advance();
                if (sizeofTypeAhead()) {
                    consume(LPAREN, "Expected '('");
                    Payload.TypeName type = typeName(RPAREN);
                    consume(RPAREN, "Expected ')' after type");
                    return new Node(NodeKind.SIZEOF, t, type);
                }
                return new Node(NodeKind.SIZEOF, t).add(unary());
            }
            case LPAREN -> {
                if (typeInParensAhead()) {
                    advance();
                    Payload.TypeName type = typeName(RPAREN);
                    consume(RPAREN, "Expected ')' after cast type");
                    return new Node(NodeKind.CAST, t, type).add(unary());
                }
                return postfix(primary());
            }
            default -> {
                return postfix(primary());
            }
        }
    }

    private Node postfix(Node e) {
        while (true) {
            if (check(LBRACKET)) {
                Token lb = advance();
                Node index = expression();
                consume(RBRACKET, "Expected ']'");
                e = new Node(NodeKind.ARRAY_ACCESS, lb).add(e).add(index);
            } else if (check(LPAREN)) {
                Token lp = advance();
                Node call = new Node(NodeKind.CALL, lp).add(e);
                if (!check(RPAREN)) {
                    do {
                        call.add(argument());
                    } while (match(COMMA));
                }
                consume(RPAREN, "Expected ')' after arguments");
                e = call;
            } else if (check(DOT) || check(ARROW)) {
                Token op = advance();
                Token member = consume(IDENTIFIER, "Expected member name after '" + op.lexeme() + "'");
                e = new Node(NodeKind.MEMBER_ACCESS, member, new Payload.Member(op.type() == ARROW)).add(e);
            } else if (check(INCREMENT) || check(DECREMENT)) {
                Token op = advance();
                e = new Node(NodeKind.UNARY, op, new Payload.Unary(true)).add(e);
            } else {
                return e;
            }
        }
    }

    // call arguments may be type names, as in va_arg(ap, char *)
    private Node argument() {
        if (typeArgumentAhead()) {
            Token first = peek();
            return new Node(NodeKind.TYPE_NAME, first, typeName(COMMA, RPAREN));
        }
        return expression();
    }

    private Node primary() {
        Token t = peek();
        switch (t.type()) {
            case INT_LITERAL, FLOAT_LITERAL, CHAR_LITERAL -> {
                return new Node(NodeKind.LITERAL, advance());
            }
            case STRING_LITERAL -> {
                advance();
                if (!check(STRING_LITERAL)) return new Node(NodeKind.LITERAL, t);
                List<Token> pieces = new ArrayList<>();
                pieces.add(t);
                while (check(STRING_LITERAL)) pieces.add(advance());
                return new Node(NodeKind.LITERAL, t, new Payload.StringPieces(pieces));
            }
            case IDENTIFIER -> {
                return new Node(NodeKind.IDENTIFIER, advance());
            }
            case LPAREN -> {
                advance();
                Node inner = expression();
                consume(RPAREN, "Expected ')'");
                return new Node(NodeKind.PAREN, t).add(inner);
            }
            default -> throw error(t, "Expected expression");
        }
    }

    private static int precedence(TokenType t) {
        if (t.isAssignment()) return 1;
        return switch (t) {
            case OR -> 2;
            case AND -> 3;
            case PIPE -> 4;
            case CARET -> 5;
            case AMP -> 6;
            case EQ, NEQ -> 7;
            case LT, LE, GT, GE -> 8;
            case SHL, SHR -> 9;
            case PLUS, MINUS -> 10;
            case STAR, SLASH, PERCENT -> 11;
            default -> -1;
        };
    }

    // ---------- type names ----------

    /**
     * At a {@code (}: true if everything up to the matching {@code )} forms a type name,
     * i.e. only type tokens, and identifiers are typedef names or struct/union/enum tags.
     */
    private boolean typeInParensAhead() {
        if (!check(LPAREN)) return false;
        int i = 1;
        boolean sawType = false;
        TokenType prev = LPAREN;
        while (true) {
            Token t = peekAt(i);
            if (t.type() == RPAREN) break;
            if (!TYPE_TOKENS.contains(t.type())) return false;
            if (t.type() == IDENTIFIER) {
                if (!AGGREGATES.contains(prev) && !symbols.isTypedef(t.lexeme())) return false;
                sawType = true;
            } else if (BASE_TYPES.contains(t.type())) {
                sawType = true;
            }
            prev = t.type();
            i++;
        }
        return sawType;
    }

    /**
     * At the {@code (} after {@code sizeof}: true if the operand is spelled with type tokens
     * only. Unlike a cast, identifiers need not be known typedefs, since the type may come
     * from a header that was never seen. {@code *} must follow the base type and may only be
     * followed by more stars or qualifiers, so {@code sizeof(*p)} and {@code sizeof(a * b)}
     * stay expressions.
     */
    private boolean sizeofTypeAhead() {
        if (!check(LPAREN)) return false;
        int i = 1;
        TokenType prev = LPAREN;
        while (true) {
            TokenType type = peekAt(i).type();
            if (type == RPAREN) return prev != LPAREN;
            if (!TYPE_TOKENS.contains(type)) return false;
            if (type == STAR && prev == LPAREN) return false;
            if (prev == STAR && type != STAR && type != CONST && type != VOLATILE) return false;
            prev = type;
            i++;
        }
    }

    private boolean typeArgumentAhead() {
        Token first = peek();
        boolean typeStart = BASE_TYPES.contains(first.type()) || AGGREGATES.contains(first.type())
                || first.type() == CONST || first.type() == VOLATILE
                || (first.type() == IDENTIFIER && symbols.isTypedef(first.lexeme()) && checkAt(1, STAR));
        if (!typeStart) return false;
        for (int i = 0; ; i++) {
            TokenType type = peekAt(i).type();
            if (type == COMMA || type == RPAREN) return i > 0;
            if (!TYPE_TOKENS.contains(type)) return false;
        }
    }

    // consumes a type name up to (not including) one of the terminators
    private Payload.TypeName typeName(TokenType... terminators) {
        List<Token> type = new ArrayList<>();
        List<Token> pointer = new ArrayList<>();
        while (!check(EOF) && !isAny(peek().type(), terminators)) {
            Token t = advance();
            if (t.type() == STAR || !pointer.isEmpty()) pointer.add(t);
            else type.add(t);
        }
        if (type.isEmpty()) throw error(peek(), "Expected type name");
        return new Payload.TypeName(type, pointer);
    }

    private static boolean isAny(TokenType type, TokenType... types) {
        for (TokenType t : types) {
            if (t == type) return true;
        }
        return false;
    }

    // consumes an open token through its matching close, returning all significant tokens
    private List<Token> balanced(TokenType open, TokenType close) {
        List<Token> out = new ArrayList<>();
        out.add(consume(open, "Expected '" + open + "'"));
        int depth = 1;
        while (depth > 0) {
            if (check(EOF)) throw error(peek(), "Unbalanced '" + open + "'");
            Token t = advance();
            if (t.type() == open) depth++;
            else if (t.type() == close) depth--;
            out.add(t);
        }
        return out;
    }

    private static NodeKind aggregateKind(Token keyword) {
        return switch (keyword.type()) {
            case STRUCT -> NodeKind.STRUCT;
            case UNION -> NodeKind.UNION;
            case ENUM -> NodeKind.ENUM;
            default -> throw new IllegalArgumentException("Not an aggregate keyword: " + keyword);
        };
    }

    private static SymbolKind tagKind(NodeKind kind) {
        return switch (kind) {
            case STRUCT -> SymbolKind.STRUCT;
            case UNION -> SymbolKind.UNION;
            case ENUM -> SymbolKind.ENUM;
            default -> throw new IllegalArgumentException("Not an aggregate: " + kind);
        };
    }

    // ---------- recovery ----------

    /**
     * Consumes raw tokens from the cursor up to a safe boundary and wraps them in an
     * {@code UNPARSED} node. At least one token is always consumed.
     */
    private Node recover(Recovery mode, ParseException cause) {
        int start = significant(pos);
        pos = start;
        int braces = 0;
        int parens = 0;
        int end = start;

        while (tokens.get(pos).type() != EOF) {
            TokenType type = tokens.get(pos).type();
            boolean topDepth = braces == 0 && parens == 0;
            boolean consumed = end > start;

            if (consumed && topDepth) {
                if (mode == Recovery.ENUM_ENTRY && (type == COMMA || type == RBRACE)) break;
                if (mode == Recovery.STATEMENT && (type == RBRACE || type == NEWLINE)) break;
            }

            pos++;
            if (!type.isTrivia()) end = pos;

            if (type == LBRACE) {
                braces++;
            } else if (type == RBRACE) {
                if (braces == 0) break;
                braces--;
                if (braces == 0 && parens == 0 && mode != Recovery.ENUM_ENTRY) {
                    // "= { ... };" ends at the semicolon, not the brace
                    int next = pos;
                    while (tokens.get(next).type() == WHITESPACE) next++;
                    if (tokens.get(next).type() == SEMICOLON) pos = end = next + 1;
                    break;
                }
            } else if (type == LPAREN || type == LBRACKET) {
                parens++;
            } else if ((type == RPAREN || type == RBRACKET) && parens > 0) {
                parens--;
            } else if (type == SEMICOLON && topDepth && mode != Recovery.ENUM_ENTRY) {
                break;
            }
        }
        pos = end;

        errorCount++;
        Node n = raw(start, end);
        Payload.RawText text = n.payload(Payload.RawText.class);
        LOG.debug("Kept lines {}-{} verbatim ({}): {}", text.startLine(), text.endLine(),
                mode, cause.getMessage());
        return n;
    }

    private Node raw(int start, int end) {
        if (end <= start) {
            Token at = tokens.get(start);
            lastConsumed = at;
            return new Node(NodeKind.UNPARSED, at,
                    new Payload.RawText("", at.line(), at.line(), at.offset(), at.offset()));
        }
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) sb.append(tokens.get(i).lexeme());
        Token first = tokens.get(start);
        Token last = tokens.get(end - 1);
        lastConsumed = last;
        return new Node(NodeKind.UNPARSED, first, new Payload.RawText(
                sb.toString(), first.line(), last.endLine(), first.offset(), last.endOffset()));
    }

    // ---------- comments & layout ----------

    /**
     * Skips trivia before the next node, returning buffered and skipped comments and whether
     * a blank line precedes the node itself.
     */
    private Leading collectLeading() {
        List<Comment> comments = new ArrayList<>();
        for (Token c : pending) comments.add(new Comment(c, false));
        pending.clear();

        int newlines = 0;
        boolean blank = false;
        while (tokens.get(pos).type().isTrivia()) {
            Token t = tokens.get(pos++);
            if (t.type() == NEWLINE) {
                if (++newlines >= 2) blank = true;
            } else if (t.type().isComment()) {
                comments.add(new Comment(t, blank));
                blank = false;
                newlines = 0;
            }
        }
        return new Leading(comments, blank);
    }

    private void attachTrailing(Node n) {
        n.trailingComments().addAll(pending);
        pending.clear();
        if (lastConsumed == null) return;

        int line = lastConsumed.endLine();
        int i = pos;
        while (true) {
            while (tokens.get(i).type() == WHITESPACE) i++;
            Token t = tokens.get(i);
            if (!t.type().isComment() || t.line() != line) return;
            n.trailingComments().add(t);
            pos = ++i;
            if (t.type() == LINE_COMMENT) return;
            line = t.endLine();
        }
    }

    private Checkpoint checkpoint() {
        return new Checkpoint(pos, pending.size(), errorCount, lastConsumed);
    }

    private void restore(Checkpoint cp) {
        pos = cp.pos();
        pending.subList(cp.pending(), pending.size()).clear();
        errorCount = cp.errors();
        lastConsumed = cp.last();
    }

    // ---------- cursor ----------
    private int significant(int from) {
        int i = from;
        while (tokens.get(i).type().isTrivia()) i++;
        return i;
    }

    private Token peek() {
        return tokens.get(significant(pos));
    }

    private Token peekAt(int n) {
        int i = significant(pos);
        for (int k = 0; k < n && tokens.get(i).type() != EOF; k++) i = significant(i + 1);
        return tokens.get(i);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkAt(int n, TokenType t) {
        return peekAt(n).type() == t;
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private Token advance() {
        while (tokens.get(pos).type().isTrivia()) {
            Token t = tokens.get(pos++);
            if (t.type().isComment()) pending.add(t);
        }
        Token t = tokens.get(pos);
        if (t.type() != EOF) pos++;
        lastConsumed = t;
        return t;
    }

    private ParseException error(Token at, String msg) {
        return new ParseException(at, msg);
    }
}
