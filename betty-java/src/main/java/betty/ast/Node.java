package betty.ast;

import betty.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * One AST node. A node owns its children and comment lists; tokens are shared with the
 * lexer's token list and never copied.
 */
public final class Node {
    private final NodeKind kind;
    private final Token token;
    private final Payload payload;
    private final List<Node> children = new ArrayList<>();

    private final List<Comment> leadingComments = new ArrayList<>();
    private final List<Token> trailingComments = new ArrayList<>();
    private final List<Comment> danglingComments = new ArrayList<>();
    private boolean blankLineBefore;

    public Node(NodeKind kind, Token token) {
        this(kind, token, null);
    }

    public Node(NodeKind kind, Token token, Payload payload) {
        this.kind = kind;
        this.token = token;
        this.payload = payload;
    }

    public NodeKind kind() { return kind; }
    public Token token() { return token; }
    public boolean is(NodeKind k) { return kind == k; }

    public List<Node> children() { return children; }
    public Node child(int i) { return children.get(i); }
    public int childCount() { return children.size(); }

    public Node add(Node child) {
        children.add(child);
        return this;
    }

    public boolean hasPayload() { return payload != null; }

    public <T extends Payload> T payload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(kind + " node has no " + type.getSimpleName() + " payload");
        }
        return type.cast(payload);
    }

    /** Comments on their own lines before this node. */
    public List<Comment> leadingComments() { return leadingComments; }

    /** Comments that end the node's last line. */
    public List<Token> trailingComments() { return trailingComments; }

    /** Comments before the closing brace of a block or body that no statement claimed. */
    public List<Comment> danglingComments() { return danglingComments; }

    public boolean blankLineBefore() { return blankLineBefore; }

    public void setBlankLineBefore(boolean blankLineBefore) {
        this.blankLineBefore = blankLineBefore;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (token != null) sb.append("('").append(token.lexeme()).append("')");
        if (!children.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
