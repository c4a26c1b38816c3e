package betty.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnifiedDiffTest {

    @Test
    void single_changed_line() {
        String diff = UnifiedDiff.diff("f.c", "a\nb\nc\n", "a\nx\nc\n");
        assertEquals("""
                --- f.c (original)
                +++ f.c (formatted)
                @@ -1,3 +1,3 @@
                 a
                -b
                +x
                 c
                """, diff);
    }

    @Test
    void distant_changes_get_separate_hunks() {
        StringBuilder a = new StringBuilder();
        StringBuilder b = new StringBuilder();
        for (int i = 1; i <= 20; i++) {
            a.append("line").append(i).append('\n');
            b.append(i == 2 || i == 19 ? "changed" + i : "line" + i).append('\n');
        }
        String diff = UnifiedDiff.diff("f.c", a.toString(), b.toString());
        assertTrue(diff.contains("@@ -1,5 +1,5 @@\n"), diff);
        assertTrue(diff.contains("@@ -16,5 +16,5 @@\n"), diff);
        assertTrue(diff.contains("-line19\n+changed19\n"), diff);
    }

    @Test
    void added_lines_at_end() {
        String diff = UnifiedDiff.diff("f.c", "a\n", "a\nb\n");
        assertTrue(diff.endsWith("@@ -1,1 +1,2 @@\n a\n+b\n"), diff);
    }

    @Test
    void identical_text_has_no_hunks() {
        assertEquals("--- f.c (original)\n+++ f.c (formatted)\n", UnifiedDiff.diff("f.c", "x\n", "x\n"));
    }
}
