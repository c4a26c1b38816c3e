package betty.ast;

import betty.lexer.Token;

/** A comment token that sits on its own line(s), and whether a blank line preceded it. */
public record Comment(Token token, boolean blankLineBefore) {
}
