package tree.ukkonen;

import utilities.SuffixTreeLogger;

/**
 * Single-use construction context running Ukkonen's on-line algorithm over a sequence
 * of dense symbol ids. Positions are 1-based: position i holds {@code text[i - 1]}.
 *
 * The active point is (activeNode, activeStart): the implicit suffix
 * {@code activeStart .. i - 1} hanging below activeNode. Each phase i runs
 * {@link #update(int)} and then re-canonizes the active point against i.
 */
final class UkkonenBuilder {

    static final int ROOT = 0;
    // Auxiliary node: one zero-length edge per symbol, each leading back to the root.
    static final int BOTTOM = 1;

    private final int[] text;
    private final int alphabetSize;
    private final UkkonenConfiguration configuration;
    private final NodeStore store;
    private final BuildStats stats;

    private int activeNode;
    private int activeStart;

    // Node returned by the last testAndSplit call.
    private int splitNode;

    private boolean used;

    UkkonenBuilder(int[] text, int alphabetSize, UkkonenConfiguration configuration) {
        this.text = text;
        this.alphabetSize = alphabetSize;
        this.configuration = configuration;
        this.store = new NodeStore(text.length);
        this.stats = new BuildStats(configuration.collectStats());
    }

    /**
     * Run every phase and return the frozen node store.
     */
    NodeStore build() {
        if (used) {
            throw new IllegalStateException("builder has already been used");
        }
        used = true;

        long startNanos = System.nanoTime();
        SuffixTreeLogger.debug("Building suffix tree over " + text.length + " symbols, alphabet size " + alphabetSize);

        bootstrap();

        int n = text.length;
        int progressInterval = configuration.progressInterval();
        for (int i = 1; i <= n; i++) {
            stats.recordPhase();
            update(i);
            canonize(i);
            if (progressInterval > 0 && i % progressInterval == 0) {
                SuffixTreeLogger.trace("Processed " + i + "/" + n + " symbols, " + store.nodeCount() + " nodes");
            }
        }

        // The root only links to the auxiliary node while the tree is being built.
        store.setSuffixLink(ROOT, NodeStore.NO_NODE);
        store.freeze();

        long elapsed = System.nanoTime() - startNanos;
        stats.recordBuildTime(elapsed);
        SuffixTreeLogger.debug("Built suffix tree: " + (store.nodeCount() - 1) + " nodes in "
                + (elapsed / 1_000_000.0) + " ms");
        return store;
    }

    BuildStats stats() {
        return stats;
    }

    private void bootstrap() {
        int root = store.newNode();
        int bottom = store.newNode();
        assert root == ROOT && bottom == BOTTOM;

        for (int symbol = 0; symbol < alphabetSize; symbol++) {
            int position = -symbol - 1;
            store.addEdge(BOTTOM, symbol, position, position, ROOT);
        }
        store.setSuffixLink(ROOT, BOTTOM);

        activeNode = ROOT;
        activeStart = 1;
    }

    private int symbolAt(int position) {
        return text[position - 1];
    }

    /**
     * Insert symbol i into every suffix that does not already continue with it, starting
     * at the active point and following suffix links until an end point is reached.
     */
    private void update(int i) {
        int symbol = symbolAt(i);
        int previous = ROOT;

        boolean endPoint = testAndSplit(activeNode, activeStart, i - 1, symbol);
        while (!endPoint) {
            int branch = splitNode;
            store.addEdge(branch, symbol, i, NodeStore.OPEN, store.newNode());
            stats.recordLeaf();

            if (previous != ROOT) {
                store.setSuffixLink(previous, branch);
            }
            previous = branch;

            activeNode = store.suffixLink(activeNode);
            stats.recordSuffixLinkWalk();
            canonize(i - 1);
            endPoint = testAndSplit(activeNode, activeStart, i - 1, symbol);
        }

        if (previous != ROOT) {
            store.setSuffixLink(previous, activeNode);
        }
    }

    /**
     * Decide whether the implicit suffix start..boundary below node is already followed by
     * symbol. Returns true on an end point. Otherwise leaves the node to branch from in
     * {@link #splitNode}, splitting the edge first when the suffix ends inside it.
     */
    private boolean testAndSplit(int node, int start, int boundary, int symbol) {
        if (start <= boundary) {
            int edge = store.edge(node, symbolAt(start));
            int edgeStart = store.start(edge);
            int splitEnd = edgeStart + boundary - start;
            int nextSymbol = symbolAt(splitEnd + 1);
            if (symbol == nextSymbol) {
                splitNode = node;
                return true;
            }
            int middle = store.newNode();
            store.splitEdge(edge, splitEnd, middle, nextSymbol);
            stats.recordSplit();
            splitNode = middle;
            return false;
        }
        splitNode = node;
        return store.edge(node, symbol) != NodeStore.NO_EDGE;
    }

    /**
     * Move the active point down to the deepest explicit node on the path of
     * activeStart..boundary. activeStart only ever grows, which bounds the total work of
     * all calls by the sequence length.
     */
    private void canonize(int boundary) {
        if (boundary < activeStart) {
            return;
        }
        int edge = store.edge(activeNode, symbolAt(activeStart));
        int edgeStart = store.start(edge);
        int edgeEnd = store.end(edge);
        while (edgeEnd - edgeStart <= boundary - activeStart) {
            activeStart += edgeEnd - edgeStart + 1;
            activeNode = store.child(edge);
            stats.recordCanonizeStep();
            if (activeStart <= boundary) {
                edge = store.edge(activeNode, symbolAt(activeStart));
                edgeStart = store.start(edge);
                edgeEnd = store.end(edge);
            }
        }
    }
}
