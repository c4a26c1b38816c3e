package betty.sema;

public enum SymbolKind {
    TYPEDEF,
    VARIABLE,
    FUNCTION,
    STRUCT,
    ENUM,
    UNION
}
