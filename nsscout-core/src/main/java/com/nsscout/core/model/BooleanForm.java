package com.nsscout.core.model;

/**
 * The literal {@code true} or {@code false}.
 *
 * @param value boolean value
 */
public record BooleanForm(boolean value) implements Form {

    public static final BooleanForm TRUE = new BooleanForm(true);
    public static final BooleanForm FALSE = new BooleanForm(false);

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
