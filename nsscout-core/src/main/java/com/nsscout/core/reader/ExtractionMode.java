package com.nsscout.core.reader;

import java.util.Locale;

/**
 * How much of a file to read when looking for namespace forms.
 */
public enum ExtractionMode {
    /** Stop reading at the first namespace form. */
    FIRST_ONLY,
    /** Read the whole file and return every namespace form. */
    ALL;

    /**
     * Stop predicate for the extraction loop.
     *
     * @param found number of namespace forms found so far
     * @return true if reading can stop
     */
    public boolean isSatisfiedBy(int found) {
        return this == FIRST_ONLY && found > 0;
    }

    /**
     * Parses {@code first-only} or {@code all}, case-insensitively; underscores and
     * dashes are interchangeable.
     *
     * @param value mode name
     * @return parsed mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ExtractionMode parse(String value) {
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown extraction mode: '" + value + "'. Use first-only or all", e);
        }
    }
}
