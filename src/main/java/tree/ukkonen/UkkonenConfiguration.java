package tree.ukkonen;

// Immutable settings for building and printing suffix trees. The construction itself has no knobs.
public final class UkkonenConfiguration {

    private static final UkkonenConfiguration DEFAULTS = builder().build();

    private final boolean collectStats;
    private final int progressInterval;
    private final int indentWidth;
    private final String openEndToken;

    private UkkonenConfiguration(Builder builder) {
        this.collectStats = builder.collectStats;
        this.progressInterval = builder.progressInterval;
        this.indentWidth = builder.indentWidth;
        this.openEndToken = builder.openEndToken;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static UkkonenConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (progressInterval < 0) {
            throw new IllegalArgumentException("progressInterval must be non-negative");
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be non-negative");
        }
        if (openEndToken == null || openEndToken.isEmpty()) {
            throw new IllegalArgumentException("openEndToken must not be empty");
        }
    }

    public boolean collectStats() { return collectStats; }
    public int progressInterval() { return progressInterval; }
    public int indentWidth() { return indentWidth; }
    public String openEndToken() { return openEndToken; }

    public Builder toBuilder() {
        return new Builder()
                .collectStats(collectStats)
                .progressInterval(progressInterval)
                .indentWidth(indentWidth)
                .openEndToken(openEndToken);
    }

    public static final class Builder {
        private boolean collectStats = true;
        private int progressInterval = 0; // 0 disables progress logging
        private int indentWidth = 3;
        private String openEndToken = "inf";

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder openEndToken(String openEndToken) {
            this.openEndToken = openEndToken;
            return this;
        }

        public UkkonenConfiguration build() {
            return new UkkonenConfiguration(this);
        }
    }
}
