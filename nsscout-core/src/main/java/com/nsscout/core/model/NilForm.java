package com.nsscout.core.model;

/**
 * The literal {@code nil}.
 */
public record NilForm() implements Form {

    public static final NilForm INSTANCE = new NilForm();

    @Override
    public String toString() {
        return "nil";
    }
}
