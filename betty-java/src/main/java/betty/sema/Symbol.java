package betty.sema;

public record Symbol(String name, SymbolKind kind) {
}
