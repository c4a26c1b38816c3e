package betty.format;

import betty.config.FormatterConfig;
import betty.lexer.Token;
import betty.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout-only formatter working line by line on the token sequence, without a parse.
 * It re-indents by brace depth, re-spaces tokens, moves an opening brace that ends a line to
 * its own line (except after {@code do} and in initializers) and collapses blank lines.
 */
public final class TokenStreamFormatter {

    private final FormatterConfig config;

    public TokenStreamFormatter() {
        this(FormatterConfig.defaults());
    }

    public TokenStreamFormatter(FormatterConfig config) {
        this.config = config;
    }

    public String format(List<Token> tokens) {
        List<String> lines = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        boolean hasContent = false;
        int depth = 0;

        for (Token t : tokens) {
            switch (t.type()) {
                case WHITESPACE -> { }
                case NEWLINE, EOF -> {
                    if (hasContent) depth = flush(current, depth, lines);
                    else if (t.type() == TokenType.NEWLINE) lines.add("");
                    current.clear();
                    hasContent = false;
                }
                case PREPROCESSOR -> {
                    depth = flush(current, depth, lines);
                    current.clear();
                    lines.add(t.lexeme().stripTrailing());
                    hasContent = true;
                }
                default -> {
                    current.add(t);
                    hasContent = true;
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        boolean lastBlank = true;
        for (String line : lines) {
            boolean blank = line.isEmpty();
            if (blank && lastBlank) continue;
            sb.append(line).append('\n');
            lastBlank = blank;
        }
        while (sb.length() >= 2 && sb.charAt(sb.length() - 1) == '\n' && sb.charAt(sb.length() - 2) == '\n') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    // renders one source line; returns the brace depth after it
    private int flush(List<Token> line, int depth, List<String> lines) {
        if (line.isEmpty()) return depth;

        int indent = line.get(0).type() == TokenType.RBRACE ? Math.max(0, depth - 1) : depth;
        int last = line.size() - 1;
        if (movesBrace(line)) {
            lines.add("\t".repeat(indent) + render(line.subList(0, last)));
            lines.add("\t".repeat(indent) + "{");
        } else {
            lines.add("\t".repeat(indent) + render(line));
        }

        for (Token t : line) {
            if (t.type() == TokenType.LBRACE) depth++;
            else if (t.type() == TokenType.RBRACE && depth > 0) depth--;
        }
        return depth;
    }

    private static boolean movesBrace(List<Token> line) {
        int last = line.size() - 1;
        if (last < 1 || line.get(last).type() != TokenType.LBRACE) return false;
        if (line.get(0).type() == TokenType.DO) return false;
        TokenType before = line.get(last - 1).type();
        return before != TokenType.ASSIGN && before != TokenType.COMMA && before != TokenType.LBRACE
                && before != TokenType.LPAREN;
    }

    private String render(List<Token> line) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        boolean prevUnary = false;
        boolean afterComment = false;
        for (Token t : line) {
            if (t.type().isComment()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(comment(t));
                afterComment = true;
                continue;
            }
            boolean unary = TokenSpacing.isUnary(prev, t, false);
            if (afterComment || (prev != null && TokenSpacing.needsSpace(prev, prevUnary, t, unary, false))) {
                sb.append(' ');
            }
            sb.append(t.lexeme());
            prev = t;
            prevUnary = unary;
            afterComment = false;
        }
        return sb.toString();
    }

    private String comment(Token t) {
        return CommentText.render(t, config.convertLineComments());
    }
}
