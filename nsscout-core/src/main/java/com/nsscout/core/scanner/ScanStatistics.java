package com.nsscout.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while scanning one classpath entry.
 *
 * <p>Lenient scans skip unreadable files silently; these counts are where such skips
 * remain visible.
 *
 * @param filesDiscovered candidate source files found in the entry
 * @param filesScanned candidates actually opened
 * @param filesWithNamespaces files that yielded at least one namespace form
 * @param filesUnreadable files that failed to open or parse
 * @param errorCounts error type ({@code syntax}, {@code io}) to occurrence count
 * @param topErrors first error messages, at most {@value #MAX_TOP_ERRORS}
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesScanned,
    int filesWithNamespaces,
    int filesUnreadable,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    public static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        if (filesDiscovered < 0) {
            filesDiscovered = 0;
        }
        if (filesScanned < 0) {
            filesScanned = 0;
        }
        if (filesWithNamespaces < 0) {
            filesWithNamespaces = 0;
        }
        if (filesUnreadable < 0) {
            filesUnreadable = 0;
        }
        if (errorCounts == null) {
            errorCounts = Map.of();
        }
        if (topErrors == null) {
            topErrors = List.of();
        }
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the share of scanned files that could not be read.
     *
     * @return failure rate as percentage (0.0 to 100.0), or 0 if no files scanned
     */
    public double getUnreadableRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return (filesUnreadable * 100.0) / filesScanned;
    }

    public boolean hasFailures() {
        return filesUnreadable > 0;
    }

    /**
     * Adds another entry's statistics to these.
     *
     * @param other statistics to add
     * @return combined statistics
     */
    public ScanStatistics plus(ScanStatistics other) {
        Map<String, Integer> counts = new HashMap<>(errorCounts);
        other.errorCounts().forEach((type, count) -> counts.merge(type, count, Integer::sum));
        List<String> errors = new ArrayList<>(topErrors);
        other.topErrors().stream()
            .limit(Math.max(0, MAX_TOP_ERRORS - errors.size()))
            .forEach(errors::add);
        return new ScanStatistics(
            filesDiscovered + other.filesDiscovered(),
            filesScanned + other.filesScanned(),
            filesWithNamespaces + other.filesWithNamespaces(),
            filesUnreadable + other.filesUnreadable(),
            Map.copyOf(counts),
            List.copyOf(errors)
        );
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Scanned: %d, With namespaces: %d, Unreadable: %d (%.1f%%)",
            filesDiscovered,
            filesScanned,
            filesWithNamespaces,
            filesUnreadable,
            getUnreadableRate()
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesScanned = 0;
        private int filesWithNamespaces = 0;
        private int filesUnreadable = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesScanned() {
            this.filesScanned++;
            return this;
        }

        public Builder incrementFilesWithNamespaces() {
            this.filesWithNamespaces++;
            return this;
        }

        public Builder incrementFilesUnreadable() {
            this.filesUnreadable++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesScanned,
                filesWithNamespaces,
                filesUnreadable,
                Map.copyOf(errorCounts),
                List.copyOf(topErrors)
            );
        }
    }
}
