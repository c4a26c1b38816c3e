package betty.format;

import betty.lexer.Token;
import betty.lexer.TokenType;

import java.util.List;

import static betty.lexer.TokenType.*;

/**
 * Decides the spacing between adjacent significant tokens: one space around binary
 * operators, none inside brackets or after a prefix operator, one after commas.
 */
public final class TokenSpacing {

    private TokenSpacing() {}

    public static String join(List<Token> tokens) {
        return join(tokens, false);
    }

    /**
     * @param typeContext the tokens spell types (parameter lists, casts), so {@code *} is a
     *                    pointer declarator and never a multiplication
     */
    public static String join(List<Token> tokens, boolean typeContext) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        boolean prevUnary = false;
        for (Token t : tokens) {
            boolean unary = isUnary(prev, t, typeContext);
            if (prev != null && needsSpace(prev, prevUnary, t, unary, typeContext)) sb.append(' ');
            sb.append(t.lexeme());
            prev = t;
            prevUnary = unary;
        }
        return sb.toString();
    }

    /** Whether {@code cur} is a prefix operator, given the significant token before it. */
    public static boolean isUnary(Token prev, Token cur, boolean typeContext) {
        return switch (cur.type()) {
            case NOT, TILDE -> true;
            case STAR -> typeContext || prev == null || !endsOperand(prev);
            case PLUS, MINUS, AMP, INCREMENT, DECREMENT -> prev == null || !endsOperand(prev);
            default -> false;
        };
    }

    public static boolean needsSpace(Token prev, boolean prevUnary, Token cur, boolean curUnary,
                                     boolean typeContext) {
        TokenType p = prev.type();
        TokenType c = cur.type();

        if (c == COMMA || c == SEMICOLON || c == RPAREN || c == RBRACKET) return false;
        if (p == LPAREN || p == LBRACKET) return false;
        if (p == DOT || p == ARROW || c == DOT || c == ARROW) return false;
        if (p == COMMA || p == SEMICOLON) return true;

        if (typeContext && c == STAR) return p != STAR;
        if (typeContext && p == STAR) return false;

        if (prevUnary) return fuses(p, c);
        if ((c == INCREMENT || c == DECREMENT) && !curUnary) return false;

        if (c == LPAREN) return !(p == IDENTIFIER || p == RPAREN || p == RBRACKET || p == SIZEOF);
        if (c == LBRACKET) return !(p == IDENTIFIER || p == RPAREN || p == RBRACKET || p == STRING_LITERAL);
        return true;
    }

    // two prefix operators that would lex as one token without a space
    static boolean fuses(TokenType first, TokenType second) {
        return switch (first) {
            case MINUS -> second == MINUS || second == DECREMENT;
            case PLUS -> second == PLUS || second == INCREMENT;
            case AMP -> second == AMP || second == AND;
            default -> false;
        };
    }

    private static boolean endsOperand(Token t) {
        return switch (t.type()) {
            case IDENTIFIER, INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, CHAR_LITERAL,
                 RPAREN, RBRACKET, INCREMENT, DECREMENT -> true;
            default -> false;
        };
    }
}
