package betty.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Line-based unified diff with three lines of context, as printed by {@code diff -u}. */
final class UnifiedDiff {

    private static final int CONTEXT = 3;

    private record Edit(char op, int aIndex, int bIndex, String text) {}

    private UnifiedDiff() {}

    static String diff(String name, String original, String formatted) {
        List<String> a = lines(original);
        List<String> b = lines(formatted);
        List<Edit> edits = script(a, b);

        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(name).append(" (original)\n");
        sb.append("+++ ").append(name).append(" (formatted)\n");

        int i = 0;
        while (i < edits.size()) {
            while (i < edits.size() && edits.get(i).op() == ' ') i++;
            if (i == edits.size()) break;

            int start = Math.max(0, i - CONTEXT);
            int lastChange = i;
            int j = i;
            while (j < edits.size()) {
                if (edits.get(j).op() != ' ') lastChange = j;
                else if (j - lastChange > 2 * CONTEXT) break;
                j++;
            }
            int end = Math.min(edits.size(), lastChange + CONTEXT + 1);
            hunk(sb, edits.subList(start, end));
            i = end;
        }
        return sb.toString();
    }

    private static void hunk(StringBuilder sb, List<Edit> hunk) {
        int aLen = 0;
        int bLen = 0;
        for (Edit e : hunk) {
            if (e.op() != '+') aLen++;
            if (e.op() != '-') bLen++;
        }
        Edit first = hunk.get(0);
        int aStart = aLen == 0 ? first.aIndex() : first.aIndex() + 1;
        int bStart = bLen == 0 ? first.bIndex() : first.bIndex() + 1;
        sb.append("@@ -").append(aStart).append(',').append(aLen)
                .append(" +").append(bStart).append(',').append(bLen).append(" @@\n");
        for (Edit e : hunk) sb.append(e.op()).append(e.text()).append('\n');
    }

    // longest common subsequence over the lines between the common prefix and suffix
    private static List<Edit> script(List<String> a, List<String> b) {
        int pre = 0;
        while (pre < a.size() && pre < b.size() && a.get(pre).equals(b.get(pre))) pre++;
        int suf = 0;
        while (suf < a.size() - pre && suf < b.size() - pre
                && a.get(a.size() - 1 - suf).equals(b.get(b.size() - 1 - suf))) suf++;

        int n = a.size() - pre - suf;
        int m = b.size() - pre - suf;
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = a.get(pre + i).equals(b.get(pre + j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<Edit> edits = new ArrayList<>();
        for (int k = 0; k < pre; k++) edits.add(new Edit(' ', k, k, a.get(k)));
        int i = 0;
        int j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && a.get(pre + i).equals(b.get(pre + j))) {
                edits.add(new Edit(' ', pre + i, pre + j, a.get(pre + i)));
                i++;
                j++;
            } else if (j == m || (i < n && lcs[i + 1][j] >= lcs[i][j + 1])) {
                edits.add(new Edit('-', pre + i, pre + j, a.get(pre + i)));
                i++;
            } else {
                edits.add(new Edit('+', pre + i, pre + j, b.get(pre + j)));
                j++;
            }
        }
        for (int k = 0; k < suf; k++) {
            edits.add(new Edit(' ', pre + n + k, pre + m + k, a.get(pre + n + k)));
        }
        return edits;
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        return out;
    }
}
