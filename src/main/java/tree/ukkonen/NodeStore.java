package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;

import java.util.ArrayList;
import java.util.List;

/**
 * Arena holding every node and edge of one suffix tree.
 *
 * Nodes and edges are plain int indices. A node owns a map from the id of the leading
 * symbol of each outgoing edge to the edge index; an edge is a (start, end, child)
 * triple of 1-based inclusive sequence positions. Suffix links are stored as node
 * indices and never imply ownership.
 *
 * The store is mutated only by {@link UkkonenBuilder} and frozen before the tree is
 * published.
 */
final class NodeStore {

    static final int NO_NODE = -1;
    static final int NO_EDGE = -1;

    // End marker for edges that grow with the construction boundary.
    static final int OPEN = Integer.MAX_VALUE;

    private final List<Int2IntOpenHashMap> children;
    private final IntArrayList suffixLinks = new IntArrayList();

    private final IntArrayList edgeStarts = new IntArrayList();
    private final IntArrayList edgeEnds = new IntArrayList();
    private final IntArrayList edgeChildren = new IntArrayList();

    private boolean frozen;

    NodeStore(int expectedLength) {
        // A tree over n symbols has at most 2n + 1 nodes plus the auxiliary node.
        int expectedNodes = Math.max(2, 2 * expectedLength + 2);
        children = new ArrayList<>(expectedNodes);
        suffixLinks.ensureCapacity(expectedNodes);
        edgeStarts.ensureCapacity(expectedNodes);
        edgeEnds.ensureCapacity(expectedNodes);
        edgeChildren.ensureCapacity(expectedNodes);
    }

    int newNode() {
        checkMutable();
        Int2IntOpenHashMap edges = new Int2IntOpenHashMap(2);
        edges.defaultReturnValue(NO_EDGE);
        children.add(edges);
        suffixLinks.add(NO_NODE);
        return children.size() - 1;
    }

    // Attach a new edge under 'node' keyed by 'symbol'. Returns the edge index.
    int addEdge(int node, int symbol, int start, int end, int child) {
        checkMutable();
        int edge = edgeStarts.size();
        edgeStarts.add(start);
        edgeEnds.add(end);
        edgeChildren.add(child);
        int previous = children.get(node).put(symbol, edge);
        if (previous != NO_EDGE) {
            throw new IllegalStateException("node " + node + " already has an edge for symbol " + symbol);
        }
        return edge;
    }

    /**
     * Split 'edge' after position 'splitEnd'. The edge keeps its start and key, now ends at
     * 'splitEnd' and points at 'middle'; the remainder (splitEnd + 1 .. old end) becomes an
     * edge of 'middle' keyed by 'remainderSymbol' leading to the old child.
     */
    void splitEdge(int edge, int splitEnd, int middle, int remainderSymbol) {
        checkMutable();
        int oldEnd = edgeEnds.getInt(edge);
        int oldChild = edgeChildren.getInt(edge);
        edgeEnds.set(edge, splitEnd);
        edgeChildren.set(edge, middle);
        addEdge(middle, remainderSymbol, splitEnd + 1, oldEnd, oldChild);
    }

    void setSuffixLink(int node, int target) {
        checkMutable();
        suffixLinks.set(node, target);
    }

    void freeze() {
        frozen = true;
    }

    boolean isFrozen() {
        return frozen;
    }

    int edge(int node, int symbol) {
        return children.get(node).get(symbol);
    }

    int suffixLink(int node) {
        return suffixLinks.getInt(node);
    }

    int start(int edge) {
        return edgeStarts.getInt(edge);
    }

    int end(int edge) {
        return edgeEnds.getInt(edge);
    }

    int child(int edge) {
        return edgeChildren.getInt(edge);
    }

    int degree(int node) {
        return children.get(node).size();
    }

    int nodeCount() {
        return children.size();
    }

    int edgeCount() {
        return edgeStarts.size();
    }

    // Outgoing edges of 'node' in ascending order of their start position.
    int[] sortedEdges(int node) {
        int[] edges = children.get(node).values().toIntArray();
        IntArrays.quickSort(edges, (a, b) -> Integer.compare(edgeStarts.getInt(a), edgeStarts.getInt(b)));
        return edges;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("node store is frozen");
        }
    }
}
