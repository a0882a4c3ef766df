package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.ukkonen.SuffixTree;

import java.util.Locale;

public class MemUtil {

    // JOL report for a finished suffix tree, optionally with the class footprint table.
    public String jolMemoryReport(SuffixTree<?> tree, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(tree);
        sb.append("\n=== Suffix tree total (tree as root) ===\n");
        sb.append("Symbols           : ").append(tree.length()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", toMiB(total.totalSize())))
                .append(" MiB\n");
        if (tree.length() > 0) {
            sb.append("Bytes per symbol  : ")
                    .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) tree.length()))
                    .append('\n');
        }

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (tree root) ---\n");
            sb.append(total.toFootprint()).append('\n');
        }

        return sb.toString();
    }

    // Like jolMemoryReport but also returns the total MiB value.
    public MemoryUsageReport jolMemoryReportWithTotal(SuffixTree<?> tree, boolean includeFootprintTable) {
        String txt = jolMemoryReport(tree, includeFootprintTable);
        long totalBytes = GraphLayout.parseInstance(tree).totalSize();
        return new MemoryUsageReport(txt, toMiB(totalBytes));
    }

    private static double toMiB(long bytes) {
        return bytes / (1024.0 * 1024.0);
    }
}
