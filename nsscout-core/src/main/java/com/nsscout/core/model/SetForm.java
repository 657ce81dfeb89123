package com.nsscout.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A set literal {@code #{a b}}. Elements keep source order; the reader rejects duplicates.
 *
 * @param elements set elements in source order
 */
public record SetForm(List<Form> elements) implements Form {

    public SetForm {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(Form::toString).collect(Collectors.joining(" ", "#{", "}"));
    }
}
