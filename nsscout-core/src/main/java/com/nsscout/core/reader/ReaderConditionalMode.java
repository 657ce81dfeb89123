package com.nsscout.core.reader;

import java.util.Locale;

/**
 * How the reader treats reader conditionals ({@code #?(...)} and {@code #?@(...)}).
 */
public enum ReaderConditionalMode {
    /** Pick the branch matching the active features, or {@code :default}. */
    ALLOW,
    /** Keep the conditional as a {@link com.nsscout.core.model.ReaderConditionalForm}. */
    PRESERVE,
    /** Fail with a {@link ReaderException}. */
    DISALLOW;

    /**
     * Parses a mode name case-insensitively ({@code allow}, {@code preserve}, {@code disallow}).
     *
     * @param value mode name
     * @return parsed mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReaderConditionalMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown reader conditional mode: '" + value + "'. Use allow, preserve or disallow", e);
        }
    }
}
