package tree.ukkonen;

import java.util.Locale;

/**
 * Counters recorded while a suffix tree is built. When collection is disabled every
 * counter stays at zero and the record methods return immediately.
 */
public final class BuildStats {

    private final boolean collecting;
    private long phases;
    private long canonizeSteps;
    private long splits;
    private long leaves;
    private long suffixLinkWalks;
    private long buildTimeNanos;

    BuildStats(boolean collecting) {
        this.collecting = collecting;
    }

    public boolean isCollecting() {
        return collecting;
    }

    void recordPhase() {
        if (collecting) {
            phases++;
        }
    }

    void recordCanonizeStep() {
        if (collecting) {
            canonizeSteps++;
        }
    }

    void recordSplit() {
        if (collecting) {
            splits++;
        }
    }

    void recordLeaf() {
        if (collecting) {
            leaves++;
        }
    }

    void recordSuffixLinkWalk() {
        if (collecting) {
            suffixLinkWalks++;
        }
    }

    void recordBuildTime(long nanos) {
        if (collecting) {
            buildTimeNanos = nanos;
        }
    }

    public long phases() { return phases; }

    // Downward steps taken by canonize over the whole run.
    public long canonizeSteps() { return canonizeSteps; }

    public long splits() { return splits; }

    public long leaves() { return leaves; }

    public long suffixLinkWalks() { return suffixLinkWalks; }

    public long buildTimeNanos() { return buildTimeNanos; }

    public double buildTimeMillis() {
        return buildTimeNanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "phases=%d canonizeSteps=%d splits=%d leaves=%d suffixLinkWalks=%d buildTime=%.3f ms",
                phases, canonizeSteps, splits, leaves, suffixLinkWalks, buildTimeMillis());
    }
}
