package tree.ukkonen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeStoreTest {

    @Test
    public void testSplitRepointsEdgeAndKeepsRemainder() {
        NodeStore store = new NodeStore(8);
        int root = store.newNode();
        int leaf = store.newNode();
        int edge = store.addEdge(root, 0, 1, NodeStore.OPEN, leaf);

        int middle = store.newNode();
        store.splitEdge(edge, 2, middle, 5);

        assertEquals(edge, store.edge(root, 0));
        assertEquals(1, store.start(edge));
        assertEquals(2, store.end(edge));
        assertEquals(middle, store.child(edge));

        int remainder = store.edge(middle, 5);
        assertEquals(3, store.start(remainder));
        assertEquals(NodeStore.OPEN, store.end(remainder));
        assertEquals(leaf, store.child(remainder));
        assertEquals(3, store.nodeCount());
        assertEquals(2, store.edgeCount());
    }

    @Test
    public void testMissingEdgesAndLinks() {
        NodeStore store = new NodeStore(0);
        int node = store.newNode();
        assertEquals(NodeStore.NO_EDGE, store.edge(node, 3));
        assertEquals(NodeStore.NO_NODE, store.suffixLink(node));
        assertEquals(0, store.degree(node));
    }

    @Test
    public void testDuplicateLeadingSymbolIsRejected() {
        NodeStore store = new NodeStore(4);
        int root = store.newNode();
        store.addEdge(root, 1, 1, 1, store.newNode());
        assertThrows(IllegalStateException.class, () -> store.addEdge(root, 1, 2, 2, store.newNode()));
    }

    @Test
    public void testSortedEdgesFollowStartPosition() {
        NodeStore store = new NodeStore(16);
        int root = store.newNode();
        int late = store.addEdge(root, 0, 9, 9, store.newNode());
        int early = store.addEdge(root, 1, 2, 4, store.newNode());
        int middle = store.addEdge(root, 2, 5, NodeStore.OPEN, store.newNode());

        assertArrayEquals(new int[] {early, middle, late}, store.sortedEdges(root));
    }

    @Test
    public void testFrozenStoreRejectsMutation() {
        NodeStore store = new NodeStore(2);
        int root = store.newNode();
        int child = store.newNode();
        store.freeze();

        assertTrue(store.isFrozen());
        assertThrows(IllegalStateException.class, store::newNode);
        assertThrows(IllegalStateException.class, () -> store.addEdge(root, 0, 1, 1, child));
        assertThrows(IllegalStateException.class, () -> store.setSuffixLink(child, root));
    }

    @Test
    public void testBuilderIsSingleUse() {
        UkkonenBuilder builder = new UkkonenBuilder(new int[] {0, 1, 0}, 2, UkkonenConfiguration.defaults());
        NodeStore store = builder.build();
        assertTrue(store.isFrozen());
        assertThrows(IllegalStateException.class, builder::build);
    }
}
