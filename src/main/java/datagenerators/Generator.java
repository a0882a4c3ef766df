package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

// Seeded random texts for construction tests and the command-line driver.
public final class Generator {

    public static final char DEFAULT_BASE = 'a';

    private Generator() {
    }

    // Uniform symbols drawn from [base, base + alphabetSize).
    public static String generateUniform(int length, int alphabetSize, char base, long seed) {
        validate(length, alphabetSize, base);

        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (base + rng.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    public static String generateUniform(int length, int alphabetSize, long seed) {
        return generateUniform(length, alphabetSize, DEFAULT_BASE, seed);
    }

    // Zipf-distributed symbols; rank 1 maps to 'base'.
    public static String generateZipf(int length, int alphabetSize, char base, double exponent, long seed) {
        validate(length, alphabetSize, base);
        if (exponent <= 0.0) {
            throw new IllegalArgumentException("exponent must be positive");
        }

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();
            chars[i] = (char) (base + (rank - 1));
        }
        return new String(chars);
    }

    // Append 'terminator', which must not already occur in 'text'.
    public static String withTerminator(String text, char terminator) {
        if (text.indexOf(terminator) >= 0) {
            throw new IllegalArgumentException("terminator '" + terminator + "' already occurs in the text");
        }
        return text + terminator;
    }

    private static void validate(int length, int alphabetSize, char base) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }
        if (base + alphabetSize - 1 > Character.MAX_VALUE) {
            throw new IllegalArgumentException("alphabet exceeds character range");
        }
    }
}
