package com.nsscout.core.model;

import java.util.Objects;

/**
 * A tagged literal such as {@code #inst "2020-01-01"}. Tags are never resolved to
 * reader functions.
 *
 * @param tag tag symbol
 * @param form tagged value
 */
public record TaggedForm(SymbolForm tag, Form form) implements Form {

    public TaggedForm {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(form, "form must not be null");
    }

    @Override
    public String toString() {
        return "#" + tag + " " + form;
    }
}
