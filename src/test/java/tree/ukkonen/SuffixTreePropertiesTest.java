package tree.ukkonen;

import datagenerators.AdversarialGenerators;
import datagenerators.Generator;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SuffixTreePropertiesTest {

    static Stream<String> terminatedTexts() {
        return Stream.of(
                "$",
                "ab$",
                "banana$",
                "abcabxabcd$",
                "mississippi$",
                Generator.withTerminator(Generator.generateUniform(200, 2, 1L), '$'),
                Generator.withTerminator(Generator.generateUniform(500, 4, 2L), '$'),
                Generator.withTerminator(Generator.generateZipf(500, 8, 'a', 1.3, 3L), '$'),
                Generator.withTerminator(AdversarialGenerators.generateRun(300, 'a'), '$'),
                Generator.withTerminator(AdversarialGenerators.generateFibonacciWord(377, 'a', 'b'), '$'),
                Generator.withTerminator(AdversarialGenerators.generateAlternatingBlocks(400, 7, new char[] {'x', 'y', 'z'}), '$'),
                Generator.withTerminator(AdversarialGenerators.generateDeBruijnSequence(new char[] {'0', '1', '2'}, 4, 250), '$'));
    }

    @ParameterizedTest
    @MethodSource("terminatedTexts")
    public void testLeavesSpellEverySuffixOnce(String text) {
        SuffixTree<Character> tree = SuffixTree.build(text);
        assertTrue(tree.hasUniqueTerminator());

        List<String> leaves = TreeWalk.leafPaths(tree);
        Collections.sort(leaves);

        List<String> suffixes = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            suffixes.add(text.substring(i));
        }
        Collections.sort(suffixes);

        assertEquals(text.length(), tree.leafCount());
        assertEquals(suffixes, leaves);
    }

    @ParameterizedTest
    @MethodSource("terminatedTexts")
    public void testInternalNodesAreBoundedByLength(String text) {
        SuffixTree<Character> tree = SuffixTree.build(text);
        assertTrue(tree.internalNodeCount() <= text.length(),
                () -> tree.internalNodeCount() + " internal nodes for " + text.length() + " symbols");
        assertEquals(tree.nodeCount(), tree.leafCount() + tree.internalNodeCount());
    }

    @ParameterizedTest
    @MethodSource("terminatedTexts")
    public void testSuffixLinksDropTheFirstSymbol(String text) {
        SuffixTree<Character> tree = SuffixTree.build(text);
        Map<SuffixTree<Character>.Node, String> paths = TreeWalk.paths(tree);
        for (Map.Entry<SuffixTree<Character>.Node, String> entry : paths.entrySet()) {
            SuffixTree<Character>.Node node = entry.getKey();
            if (!node.isRoot() && !node.isLeaf()) {
                assertEquals(entry.getValue().substring(1), paths.get(node.getSuffixLink()));
            }
        }
    }

    @ParameterizedTest
    @MethodSource("terminatedTexts")
    public void testBuildIsDeterministic(String text) {
        assertEquals(SuffixTree.build(text).toDebugString(), SuffixTree.build(text).toDebugString());
    }

    @ParameterizedTest
    @ValueSource(ints = {10, 100, 1_000, 10_000, 100_000})
    public void testCanonizeStepsGrowLinearly(int length) {
        String[] inputs = {
                Generator.generateUniform(length, 2, length),
                Generator.generateUniform(length, 26, length + 1L),
                AdversarialGenerators.generateRun(length, 'a'),
                AdversarialGenerators.generateFibonacciWord(length, 'a', 'b'),
        };
        for (String input : inputs) {
            SuffixTree<Character> tree = SuffixTree.build(input);
            BuildStats stats = tree.stats();
            assertEquals(length, stats.phases());
            assertTrue(stats.canonizeSteps() <= length + 1L,
                    () -> stats.canonizeSteps() + " canonize steps for " + length + " symbols");
            assertTrue(stats.suffixLinkWalks() <= length,
                    () -> stats.suffixLinkWalks() + " suffix link walks for " + length + " symbols");
        }
    }
}
