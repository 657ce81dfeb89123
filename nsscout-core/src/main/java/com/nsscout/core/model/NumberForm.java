package com.nsscout.core.model;

import java.util.Objects;

/**
 * A numeric literal kept as its source text ({@code 42}, {@code 0xFF}, {@code 1/2},
 * {@code 3.0M}, {@code ##Inf}).
 *
 * @param text literal as written
 */
public record NumberForm(String text) implements Form {

    public NumberForm {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String toString() {
        return text;
    }
}
