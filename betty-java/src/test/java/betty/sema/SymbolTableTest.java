package betty.sema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    @Test
    void standard_typedefs_are_seeded() {
        var global = SymbolTable.withStandardTypedefs();
        assertTrue(global.isTypedef("size_t"));
        assertTrue(global.isTypedef("FILE"));
        assertTrue(global.isTypedef("uint64_t"));
        assertFalse(global.isTypedef("node_t"));
        assertNull(new SymbolTable().lookup("size_t"));
    }

    @Test
    void add_is_idempotent_and_keeps_first_kind() {
        var s = new SymbolTable();
        s.add("x", SymbolKind.VARIABLE);
        assertDoesNotThrow(() -> s.add("x", SymbolKind.TYPEDEF));
        assertEquals(SymbolKind.VARIABLE, s.lookup("x").kind());
        assertFalse(s.isTypedef("x"));
    }

    @Test
    void lookup_walks_outward_only() {
        var global = new SymbolTable();
        global.add("T", SymbolKind.TYPEDEF);
        var inner = new SymbolTable(global);
        inner.add("local", SymbolKind.VARIABLE);

        assertSame(global, inner.parent());
        assertEquals(SymbolKind.TYPEDEF, inner.lookup("T").kind());
        assertNull(inner.getLocal("T"));
        assertNull(global.lookup("local"));
    }

    @Test
    void typedef_in_any_enclosing_scope_counts() {
        var global = new SymbolTable();
        global.add("T", SymbolKind.TYPEDEF);
        var inner = new SymbolTable(global);
        inner.add("T", SymbolKind.VARIABLE);

        assertEquals(SymbolKind.VARIABLE, inner.lookup("T").kind());
        assertTrue(inner.isTypedef("T"));
    }

    @Test
    void tags_do_not_shadow_plain_names() {
        var s = new SymbolTable();
        s.addTag(SymbolKind.STRUCT, "node");
        assertNull(s.lookup("node"));
        assertFalse(s.isTypedef("node"));
        assertEquals(SymbolKind.STRUCT, s.lookup("struct node").kind());
        assertEquals("enum color", SymbolTable.tagKey(SymbolKind.ENUM, "color"));
        assertThrows(IllegalArgumentException.class, () -> SymbolTable.tagKey(SymbolKind.TYPEDEF, "x"));
    }
}
