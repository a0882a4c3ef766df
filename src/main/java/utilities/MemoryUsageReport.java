package utilities;

/** Human-readable JOL report for one suffix tree plus its total size in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
