package com.nsscout.core.scanner;

import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConfig;

/**
 * Settings shared by every entry scanned in one call.
 *
 * @param readerConfig reader settings passed to every parse
 * @param prefix namespace name prefix narrowing the scan, or {@code null} for everything
 * @param lenient whether unreadable files are skipped ({@code true}) or abort the scan
 * @param extractionMode first namespace form per file, or all of them
 */
public record ScanContext(
    ReaderConfig readerConfig,
    String prefix,
    boolean lenient,
    ExtractionMode extractionMode
) {
    /**
     * Compact constructor with defaults.
     */
    public ScanContext {
        if (readerConfig == null) {
            readerConfig = ReaderConfig.environment();
        }
        if (prefix != null && prefix.isEmpty()) {
            prefix = null;
        }
        if (extractionMode == null) {
            extractionMode = ExtractionMode.FIRST_ONLY;
        }
    }

    /**
     * Lenient, first-form-only scan of everything.
     *
     * @param readerConfig reader settings
     * @return default context
     */
    public static ScanContext defaults(ReaderConfig readerConfig) {
        return new ScanContext(readerConfig, null, true, ExtractionMode.FIRST_ONLY);
    }

    public static ScanContext defaults() {
        return defaults(ReaderConfig.environment());
    }

    public boolean hasPrefix() {
        return prefix != null;
    }

    public ScanContext withPrefix(String newPrefix) {
        return new ScanContext(readerConfig, newPrefix, lenient, extractionMode);
    }

    public ScanContext withLenient(boolean newLenient) {
        return new ScanContext(readerConfig, prefix, newLenient, extractionMode);
    }

    public ScanContext strict() {
        return withLenient(false);
    }

    public ScanContext withExtractionMode(ExtractionMode mode) {
        return new ScanContext(readerConfig, prefix, lenient, mode);
    }
}
