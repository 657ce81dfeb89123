package com.nsscout.core.model;

import java.util.Objects;

/**
 * A regular expression literal {@code #"..."}, kept as its pattern source.
 *
 * @param pattern pattern text exactly as written between the quotes
 */
public record RegexForm(String pattern) implements Form {

    public RegexForm {
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public String toString() {
        return "#\"" + pattern + "\"";
    }
}
