package betty.format;

import betty.lexer.Token;
import betty.lexer.TokenType;

final class CommentText {

    private CommentText() {}

    /** Rewrites a line comment in block form, unless its text contains a block comment terminator. */
    static String render(Token comment, boolean convertLineComments) {
        if (comment.type() != TokenType.LINE_COMMENT || !convertLineComments) return comment.lexeme();
        String text = comment.lexeme().substring(2).strip();
        if (text.contains("*/")) return comment.lexeme();
        return text.isEmpty() ? "/* */" : "/* " + text + " */";
    }
}
