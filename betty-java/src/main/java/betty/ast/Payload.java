package betty.ast;

import betty.lexer.Token;

import java.util.List;

/**
 * Kind-specific data carried by a {@link Node}. Token lists hold significant tokens only,
 * in source order; pointer lists hold {@code *} tokens and the qualifiers that follow them.
 */
public sealed interface Payload
        permits Payload.FunctionInfo, Payload.VarDeclInfo, Payload.TypedefInfo,
        Payload.FuncPtrInfo, Payload.ParamInfo, Payload.Aggregate, Payload.TypeName,
        Payload.Member, Payload.Unary, Payload.ForClauses, Payload.StringPieces,
        Payload.RawText {

    /**
     * Children: parameters ({@code PARAM} or {@code FUNC_PTR}), then the body {@code BLOCK}
     * when {@code definition} is set. The node token is the function name.
     */
    record FunctionInfo(List<Token> returnType, List<Token> pointer, List<Token> attributes,
                        boolean definition) implements Payload {}

    /**
     * Children: the inline aggregate definition when {@code inlineAggregate} is set, then one
     * initializer per declarator that has {@code initialized}, in declarator order.
     */
    record VarDeclInfo(List<Token> type, List<Declarator> declarators,
                       boolean inlineAggregate) implements Payload {}

    record Declarator(List<Token> pointer, Token name, List<Token> array, List<Token> bitWidth,
                      boolean initialized) {}

    /**
     * A typedef either names a plain type ({@code baseType} + declarator parts), or wraps a
     * single child: an aggregate definition or a {@code FUNC_PTR}.
     */
    record TypedefInfo(List<Token> baseType, List<Token> pointer, Token alias,
                       List<Token> array) implements Payload {}

    /** {@code returnType pointer (*name)(params)}; a single child is the initializer. */
    record FuncPtrInfo(List<Token> returnType, List<Token> pointer, Token name,
                       List<Token> params) implements Payload {}

    /** The node token is the parameter name, the {@code ...} token, or null when unnamed. */
    record ParamInfo(List<Token> type, List<Token> pointer, List<Token> array) implements Payload {}

    /** Struct, union or enum; the node token is the tag or null when anonymous. */
    record Aggregate(Token keyword, boolean hasBody) implements Payload {}

    record TypeName(List<Token> type, List<Token> pointer) implements Payload {}

    /** The node token is the member name; child 0 is the object. */
    record Member(boolean arrow) implements Payload {}

    record Unary(boolean postfix) implements Payload {}

    /** Children: init clauses, condition (if present), update clauses, body. */
    record ForClauses(int initCount, boolean hasCondition, int updateCount) implements Payload {}

    /** Adjacent string literals that the compiler concatenates. */
    record StringPieces(List<Token> pieces) implements Payload {}

    /** Verbatim source kept by error recovery. */
    record RawText(String text, int startLine, int endLine, int startOffset,
                   int endOffset) implements Payload {}
}
