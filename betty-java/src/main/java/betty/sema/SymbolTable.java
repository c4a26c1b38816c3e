package betty.sema;

import java.util.HashMap;
import java.util.Map;

/**
 * One lexical scope of names, chained to its enclosing scope.
 * Struct, union and enum tags live in the same map under keys such as {@code "struct node"},
 * so a tag never shadows an ordinary identifier.
 */
public final class SymbolTable {

    /** Type names a C file commonly uses without declaring them itself. */
    public static final String[] STANDARD_TYPEDEFS = {
            "size_t", "ssize_t", "ptrdiff_t", "intptr_t", "uintptr_t",
            "int8_t", "int16_t", "int32_t", "int64_t",
            "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            "va_list", "FILE", "DIR", "time_t", "clock_t",
            "pid_t", "uid_t", "gid_t", "off_t", "mode_t",
            "bool", "wchar_t"
    };

    private final SymbolTable parent;
    private final Map<String, Symbol> symbols = new HashMap<>();

    public SymbolTable() { this(null); }

    public SymbolTable(SymbolTable parent) {
        this.parent = parent;
    }

    public static SymbolTable withStandardTypedefs() {
        SymbolTable global = new SymbolTable();
        for (String name : STANDARD_TYPEDEFS) global.add(name, SymbolKind.TYPEDEF);
        return global;
    }

    public SymbolTable parent() { return parent; }

    /** Registers {@code name} in this scope. A name already present keeps its first kind. */
    public void add(String name, SymbolKind kind) {
        symbols.putIfAbsent(name, new Symbol(name, kind));
    }

    public void addTag(SymbolKind kind, String tag) {
        add(tagKey(kind, tag), kind);
    }

    public Symbol lookup(String name) {
        for (SymbolTable s = this; s != null; s = s.parent) {
            Symbol sym = s.symbols.get(name);
            if (sym != null) return sym;
        }
        return null;
    }

    public Symbol getLocal(String name) {
        return symbols.get(name);
    }

    /** True if any enclosing scope registered {@code name} as a typedef. */
    public boolean isTypedef(String name) {
        for (SymbolTable s = this; s != null; s = s.parent) {
            Symbol sym = s.symbols.get(name);
            if (sym != null && sym.kind() == SymbolKind.TYPEDEF) return true;
        }
        return false;
    }

    public static String tagKey(SymbolKind kind, String tag) {
        String keyword = switch (kind) {
            case STRUCT -> "struct";
            case UNION -> "union";
            case ENUM -> "enum";
            default -> throw new IllegalArgumentException("Not a tag kind: " + kind);
        };
        return keyword + " " + tag;
    }
}
