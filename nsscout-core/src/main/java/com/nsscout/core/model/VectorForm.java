package com.nsscout.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A vector literal {@code [a b c]}.
 *
 * @param elements vector elements in source order
 */
public record VectorForm(List<Form> elements) implements Form {

    public VectorForm {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static VectorForm of(Form... elements) {
        return new VectorForm(List.of(elements));
    }

    @Override
    public String toString() {
        return elements.stream().map(Form::toString).collect(Collectors.joining(" ", "[", "]"));
    }
}
