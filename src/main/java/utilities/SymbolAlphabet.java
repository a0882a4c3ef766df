package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dense id assignment for the symbols of one sequence. Ids start at 0 and follow
 * first-seen order; no id is reserved, so any symbol value may appear in the input.
 */
public class SymbolAlphabet<T> {
    public static final int NO_ID = -1;

    private final float loadFactor = 0.75f;

    // Primitive map to avoid boxing on the lookup path
    private final Object2IntOpenHashMap<T> symbolToId;
    private final List<T> idToSymbol;

    public SymbolAlphabet(int capacity) {
        int expected = Math.max(1, capacity);

        // Pre-size to the expected alphabet size to avoid rehashing.
        this.symbolToId = new Object2IntOpenHashMap<>(expected, loadFactor);
        this.symbolToId.defaultReturnValue(NO_ID);
        this.idToSymbol = new ArrayList<>(Math.min(expected, 1024));
    }

    public int getSize() {
        return symbolToId.size();
    }

    // Insert-on-miss mapping
    public int getId(T symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        int id = symbolToId.getInt(symbol);
        if (id == NO_ID) {
            id = idToSymbol.size();
            symbolToId.put(symbol, id);
            idToSymbol.add(symbol);
        }
        return id;
    }

    // Lookup without insertion; NO_ID when the symbol never occurred.
    public int lookup(Object symbol) {
        if (symbol == null) {
            return NO_ID;
        }
        return symbolToId.getInt(symbol);
    }

    public T symbol(int id) {
        return idToSymbol.get(id);
    }

    public List<T> symbols() {
        return Collections.unmodifiableList(idToSymbol);
    }

    // Map a whole sequence, growing the alphabet as needed.
    public int[] encode(List<? extends T> sequence) {
        int[] ids = new int[sequence.size()];
        int i = 0;
        for (T symbol : sequence) {
            if (symbol == null) {
                throw new IllegalArgumentException("sequence contains a null symbol at index " + i);
            }
            ids[i++] = getId(symbol);
        }
        return ids;
    }
}
