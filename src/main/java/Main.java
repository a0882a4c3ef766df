import datagenerators.Generator;
import tree.ukkonen.SuffixTree;
import tree.ukkonen.UkkonenConfiguration;
import utilities.MemUtil;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command-line driver: builds a suffix tree from a literal text, a file or a generated
 * sequence and prints its dump, construction statistics and, optionally, a JOL memory report.
 *
 * <pre>
 *   --text cacao
 *   --file data.txt --terminator $ --stats --no-dump
 *   --random 100000 --alphabet 4 --seed 7 --zipf 1.2 --terminator $ --stats --mem
 * </pre>
 */
public final class Main {

    private static final int DEFAULT_ALPHABET = 4;
    private static final long DEFAULT_SEED = 42L;

    private Main() {
    }

    public static void main(String[] args) throws IOException {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream out) throws IOException {
        CliOptions options = CliOptions.parse(args);
        String text = options.loadText();
        if (options.terminator != null && !text.endsWith(String.valueOf(options.terminator))) {
            text = Generator.withTerminator(text, options.terminator);
        }

        UkkonenConfiguration configuration = UkkonenConfiguration.builder()
                .collectStats(options.stats)
                .progressInterval(options.progressInterval)
                .build();

        SuffixTreeLogger.debug("Input: " + options.describeSource() + ", " + text.length() + " symbols");
        SuffixTree<Character> tree = SuffixTree.build(text, configuration);

        if (options.dump) {
            String dump = tree.toDebugString();
            if (!dump.isEmpty()) {
                out.println(dump);
            }
        }
        if (options.stats) {
            out.printf(Locale.ROOT, "Length: %d  Alphabet: %d  Nodes: %d  Leaves: %d  Internal: %d%n",
                    tree.length(), tree.alphabetSize(), tree.nodeCount(), tree.leafCount(), tree.internalNodeCount());
            out.println("Stats: " + tree.stats());
        }
        if (options.mem) {
            MemoryUsageReport report = new MemUtil().jolMemoryReportWithTotal(tree, false);
            out.println(report.report());
            out.printf(Locale.ROOT, "Total: %.3f MiB%n", report.totalMiB());
        }
    }

    static final class CliOptions {
        final String text;
        final Path file;
        final int randomLength;
        final int alphabet;
        final long seed;
        final double zipfExponent;
        final Character terminator;
        final boolean dump;
        final boolean stats;
        final boolean mem;
        final int progressInterval;

        private CliOptions(String text,
                           Path file,
                           int randomLength,
                           int alphabet,
                           long seed,
                           double zipfExponent,
                           Character terminator,
                           boolean dump,
                           boolean stats,
                           boolean mem,
                           int progressInterval) {
            this.text = text;
            this.file = file;
            this.randomLength = randomLength;
            this.alphabet = alphabet;
            this.seed = seed;
            this.zipfExponent = zipfExponent;
            this.terminator = terminator;
            this.dump = dump;
            this.stats = stats;
            this.mem = mem;
            this.progressInterval = progressInterval;
        }

        static CliOptions parse(String[] args) {
            String text = null;
            Path file = null;
            int randomLength = -1;
            int alphabet = DEFAULT_ALPHABET;
            long seed = DEFAULT_SEED;
            double zipf = 0.0;
            Character terminator = null;
            boolean dump = true;
            boolean stats = false;
            boolean mem = false;
            int progress = 0;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key = arg.substring(2);
                switch (key) {
                    case "no-dump" -> {
                        dump = false;
                        continue;
                    }
                    case "stats" -> {
                        stats = true;
                        continue;
                    }
                    case "mem" -> {
                        mem = true;
                        continue;
                    }
                    default -> {
                    }
                }

                String value;
                int eq = key.indexOf('=');
                if (eq >= 0) {
                    value = key.substring(eq + 1);
                    key = key.substring(0, eq);
                } else {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "text" -> text = value;
                    case "file" -> file = Path.of(value);
                    case "random" -> randomLength = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "zipf" -> zipf = Double.parseDouble(value);
                    case "progress" -> progress = Integer.parseInt(value);
                    case "terminator" -> {
                        if (value.length() != 1) {
                            throw new IllegalArgumentException("--terminator takes a single character");
                        }
                        terminator = value.charAt(0);
                    }
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            int sources = (text != null ? 1 : 0) + (file != null ? 1 : 0) + (randomLength >= 0 ? 1 : 0);
            if (sources != 1) {
                throw new IllegalArgumentException("Exactly one of --text, --file or --random is required");
            }
            return new CliOptions(text, file, randomLength, alphabet, seed, zipf, terminator, dump, stats, mem, progress);
        }

        String loadText() throws IOException {
            if (text != null) {
                return text;
            }
            if (file != null) {
                return Files.readString(file, StandardCharsets.UTF_8);
            }
            if (zipfExponent > 0.0) {
                return Generator.generateZipf(randomLength, alphabet, Generator.DEFAULT_BASE, zipfExponent, seed);
            }
            return Generator.generateUniform(randomLength, alphabet, seed);
        }

        String describeSource() {
            if (text != null) {
                return "literal text";
            }
            if (file != null) {
                return "file " + file;
            }
            return "generated sequence (seed " + seed + ")";
        }
    }
}
