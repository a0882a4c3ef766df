package datagenerators;

import java.util.Arrays;
import java.util.Objects;

// Highly repetitive texts that produce deep trees or long suffix-link chains.
public final class AdversarialGenerators {

    private AdversarialGenerators() {
    }

    // A single symbol repeated; the tree degenerates into a chain of depth 'length'.
    public static String generateRun(int length, char symbol) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        return String.valueOf(symbol).repeat(length);
    }

    // Runs of 'blockLength' copies of each alphabet symbol in turn. Every block boundary
    // forces a branch, so the tree gets many internal nodes chained by suffix links.
    public static String generateAlternatingBlocks(int totalLength,
                                                   int blockLength,
                                                   char[] alphabet) {
        if (totalLength <= 0 || blockLength <= 0) {
            throw new IllegalArgumentException("totalLength and blockLength must be positive");
        }
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length == 0) {
            throw new IllegalArgumentException("alphabet must contain at least one character");
        }

        char[] out = new char[totalLength];
        for (int i = 0; i < totalLength; i++) {
            out[i] = alphabet[(i / blockLength) % alphabet.length];
        }
        return new String(out);
    }

    // Prefix of the infinite Fibonacci word over {a, b}.
    public static String generateFibonacciWord(int length, char a, char b) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (a == b) {
            throw new IllegalArgumentException("symbols must differ");
        }
        StringBuilder previous = new StringBuilder().append(a);
        StringBuilder current = new StringBuilder().append(a).append(b);
        while (current.length() < length) {
            StringBuilder next = new StringBuilder(current.length() + previous.length())
                    .append(current)
                    .append(previous);
            previous = current;
            current = next;
        }
        return current.substring(0, length);
    }

    // Repeated de Bruijn cycles: every word of length 'order' occurs, so the top 'order'
    // levels of the tree are fully branched.
    public static String generateDeBruijnSequence(char[] alphabet,
                                                  int order,
                                                  int totalLength) {
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length < 2) {
            throw new IllegalArgumentException("alphabet must contain at least two symbols");
        }
        if (order < 1) {
            throw new IllegalArgumentException("order must be positive");
        }
        if (totalLength <= 0) {
            throw new IllegalArgumentException("totalLength must be positive");
        }

        StringBuilder sb = new StringBuilder(totalLength);
        int[] work = new int[order + 1];
        while (sb.length() < totalLength) {
            Arrays.fill(work, 0);
            if (!emitDeBruijnCycle(1, 1, order, work, alphabet, sb, totalLength)) {
                break;
            }
        }
        return sb.toString();
    }

    // Concatenates, in lexicographic order, the Lyndon words whose length divides 'order'
    // (FKM algorithm). Returns false once 'limit' symbols have been written.
    private static boolean emitDeBruijnCycle(int position,
                                             int period,
                                             int order,
                                             int[] word,
                                             char[] alphabet,
                                             StringBuilder out,
                                             int limit) {
        if (position > order) {
            if (order % period != 0) {
                return true;
            }
            for (int i = 1; i <= period; i++) {
                out.append(alphabet[word[i]]);
                if (out.length() >= limit) {
                    return false;
                }
            }
            return true;
        }
        for (int symbol = word[position - period]; symbol < alphabet.length; symbol++) {
            word[position] = symbol;
            int nextPeriod = symbol == word[position - period] ? period : position;
            if (!emitDeBruijnCycle(position + 1, nextPeriod, order, word, alphabet, out, limit)) {
                return false;
            }
        }
        return true;
    }
}
