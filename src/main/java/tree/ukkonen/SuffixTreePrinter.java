package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;

/**
 * Pre-order text dump of a finished tree, one edge per line:
 * <pre>
 * &lt;edge-index&gt;: &lt;indent&gt;(&lt;start&gt;,&lt;end&gt;) "&lt;label&gt;"
 * </pre>
 * Siblings appear in ascending start order. Uses an explicit stack, so deep trees over
 * highly repetitive input do not exhaust the call stack.
 */
public final class SuffixTreePrinter {

    private final String indentUnit;
    private final String openEndToken;

    public SuffixTreePrinter() {
        this(UkkonenConfiguration.defaults());
    }

    public SuffixTreePrinter(UkkonenConfiguration configuration) {
        this.indentUnit = " ".repeat(configuration.indentWidth());
        this.openEndToken = configuration.openEndToken();
    }

    public String print(SuffixTree<?> tree) {
        StringBuilder out = new StringBuilder();
        print(tree, out);
        return out.toString();
    }

    public void print(SuffixTree<?> tree, StringBuilder out) {
        NodeStore store = tree.store();
        List<?> sequence = tree.getSequence();

        IntArrayList edges = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        pushChildren(store, UkkonenBuilder.ROOT, 0, edges, depths);

        int index = 0;
        while (!edges.isEmpty()) {
            int edge = edges.popInt();
            int depth = depths.popInt();

            int start = store.start(edge);
            int end = store.end(edge);
            boolean open = end == NodeStore.OPEN;
            int last = open ? sequence.size() : end;

            if (index > 0) {
                out.append('\n');
            }
            out.append(index++).append(": ");
            for (int d = 0; d < depth; d++) {
                out.append(indentUnit);
            }
            out.append('(').append(start).append(',');
            if (open) {
                out.append(openEndToken);
            } else {
                out.append(end);
            }
            out.append(") \"");
            for (int p = start; p <= last; p++) {
                out.append(sequence.get(p - 1));
            }
            out.append('"');

            pushChildren(store, store.child(edge), depth + 1, edges, depths);
        }
    }

    // Push in reverse so the smallest start is popped first.
    private static void pushChildren(NodeStore store, int node, int depth, IntArrayList edges, IntArrayList depths) {
        int[] sorted = store.sortedEdges(node);
        for (int k = sorted.length - 1; k >= 0; k--) {
            edges.push(sorted[k]);
            depths.push(depth);
        }
    }
}
