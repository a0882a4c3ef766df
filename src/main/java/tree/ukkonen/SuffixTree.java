package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import utilities.SymbolAlphabet;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Suffix tree over an arbitrary symbol sequence, built in linear time with Ukkonen's
 * on-line algorithm.
 *
 * The tree is immutable once {@link #build(List)} returns and may be read from several
 * threads. Edge positions are 1-based and inclusive; an open edge ends at the last
 * position of the sequence.
 *
 * Callers that need one leaf per suffix must end the sequence with a symbol that occurs
 * nowhere else (see {@link #hasUniqueTerminator()}).
 */
public final class SuffixTree<T> {

    private final List<T> sequence;
    private final SymbolAlphabet<T> alphabet;
    private final int[] text;
    private final NodeStore store;
    private final BuildStats stats;
    private final UkkonenConfiguration configuration;

    private SuffixTree(List<T> sequence,
                       SymbolAlphabet<T> alphabet,
                       int[] text,
                       NodeStore store,
                       BuildStats stats,
                       UkkonenConfiguration configuration) {
        this.sequence = sequence;
        this.alphabet = alphabet;
        this.text = text;
        this.store = store;
        this.stats = stats;
        this.configuration = configuration;
    }

    // Build a suffix tree over the characters of 'text'.
    public static SuffixTree<Character> build(CharSequence text) {
        return build(text, UkkonenConfiguration.defaults());
    }

    public static SuffixTree<Character> build(CharSequence text, UkkonenConfiguration configuration) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        List<Character> chars = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            chars.add(text.charAt(i));
        }
        return build(chars, configuration);
    }

    public static <T> SuffixTree<T> build(List<? extends T> sequence) {
        return build(sequence, UkkonenConfiguration.defaults());
    }

    public static <T> SuffixTree<T> build(List<? extends T> sequence, UkkonenConfiguration configuration) {
        if (sequence == null) {
            throw new IllegalArgumentException("sequence cannot be null");
        }
        Objects.requireNonNull(configuration, "configuration");

        List<T> copy = Collections.unmodifiableList(new ArrayList<>(sequence));
        SymbolAlphabet<T> alphabet = new SymbolAlphabet<>(Math.min(copy.size(), 1 << 16));
        int[] text = alphabet.encode(copy);

        UkkonenBuilder builder = new UkkonenBuilder(text, alphabet.getSize(), configuration);
        NodeStore store = builder.build();
        return new SuffixTree<>(copy, alphabet, text, store, builder.stats(), configuration);
    }

    public Node getRoot() {
        return new Node(UkkonenBuilder.ROOT);
    }

    // The indexed sequence, unmodifiable.
    public List<T> getSequence() {
        return sequence;
    }

    public int length() {
        return text.length;
    }

    public int alphabetSize() {
        return alphabet.getSize();
    }

    // True when the last symbol occurs nowhere earlier in the sequence.
    public boolean hasUniqueTerminator() {
        if (text.length == 0) {
            return false;
        }
        int last = text[text.length - 1];
        for (int i = 0; i < text.length - 1; i++) {
            if (text[i] == last) {
                return false;
            }
        }
        return true;
    }

    public BuildStats stats() {
        return stats;
    }

    public UkkonenConfiguration configuration() {
        return configuration;
    }

    // Nodes reachable from the root, the root included.
    public int nodeCount() {
        return count(false, false);
    }

    public int leafCount() {
        return count(true, false);
    }

    // Nodes with at least one child; the root is counted even when the tree is empty.
    public int internalNodeCount() {
        return count(false, true);
    }

    public int edgeCount() {
        return nodeCount() - 1;
    }

    NodeStore store() {
        return store;
    }

    public String toDebugString() {
        return new SuffixTreePrinter(configuration).print(this);
    }

    @Override
    public String toString() {
        return "SuffixTree{length=" + text.length + ", alphabet=" + alphabet.getSize() + "}";
    }

    private int count(boolean leavesOnly, boolean internalOnly) {
        int total = 0;
        IntArrayList stack = new IntArrayList();
        stack.push(UkkonenBuilder.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            boolean leaf = node != UkkonenBuilder.ROOT && store.degree(node) == 0;
            if ((!leavesOnly || leaf) && (!internalOnly || !leaf)) {
                total++;
            }
            for (int edge : store.sortedEdges(node)) {
                stack.push(store.child(edge));
            }
        }
        return total;
    }

    /**
     * Read-only view of one tree node.
     */
    public final class Node {
        private final int id;

        private Node(int id) {
            this.id = id;
        }

        // Arena index; the root is 0.
        public int id() {
            return id;
        }

        public boolean isRoot() {
            return id == UkkonenBuilder.ROOT;
        }

        public boolean isLeaf() {
            return !isRoot() && store.degree(id) == 0;
        }

        // Outgoing edges in ascending order of start position.
        public List<Edge> getEdges() {
            int[] edges = store.sortedEdges(id);
            List<Edge> views = new ArrayList<>(edges.length);
            for (int edge : edges) {
                views.add(new Edge(edge));
            }
            return Collections.unmodifiableList(views);
        }

        // Outgoing edge whose label starts with 'symbol', or null.
        public Edge getEdge(T symbol) {
            int symbolId = alphabet.lookup(symbol);
            if (symbolId == SymbolAlphabet.NO_ID) {
                return null;
            }
            int edge = store.edge(id, symbolId);
            return edge == NodeStore.NO_EDGE ? null : new Edge(edge);
        }

        // Node for this node's path minus its first symbol; null for the root and for leaves.
        public Node getSuffixLink() {
            int link = store.suffixLink(id);
            return link == NodeStore.NO_NODE ? null : new Node(link);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SuffixTree.Node)) {
                return false;
            }
            SuffixTree<?>.Node other = (SuffixTree<?>.Node) o;
            return id == other.id && (Object) owner() == other.owner();
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return "Node{" + id + "}";
        }

        private SuffixTree<T> owner() {
            return SuffixTree.this;
        }
    }

    /**
     * Read-only view of one tree edge labelled by sequence positions start..end.
     */
    public final class Edge {
        private final int id;

        private Edge(int id) {
            this.id = id;
        }

        public int getStart() {
            return store.start(id);
        }

        // Resolved end position; an open edge ends at the sequence length.
        public int getEnd() {
            int end = store.end(id);
            return end == NodeStore.OPEN ? text.length : end;
        }

        public boolean isOpen() {
            return store.end(id) == NodeStore.OPEN;
        }

        public int length() {
            return getEnd() - getStart() + 1;
        }

        public List<T> getLabel() {
            final int from = getStart() - 1;
            final int size = length();
            return new AbstractList<T>() {
                @Override
                public T get(int index) {
                    Objects.checkIndex(index, size);
                    return sequence.get(from + index);
                }

                @Override
                public int size() {
                    return size;
                }
            };
        }

        public Node getChild() {
            return new Node(store.child(id));
        }

        @Override
        public String toString() {
            return "(" + getStart() + "," + (isOpen() ? configuration.openEndToken() : String.valueOf(getEnd())) + ")";
        }
    }
}
