package com.nsscout.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parenthesized list {@code (a b c)}.
 *
 * @param elements list elements in source order
 */
public record ListForm(List<Form> elements) implements Form {

    public static final ListForm EMPTY = new ListForm(List.of());

    public ListForm {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static ListForm of(Form... elements) {
        return new ListForm(List.of(elements));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    public Form get(int index) {
        return elements.get(index);
    }

    /**
     * Returns the head of the list, or {@code null} for the empty list.
     *
     * @return first element or null
     */
    public Form first() {
        return elements.isEmpty() ? null : elements.get(0);
    }

    /**
     * Checks whether this list starts with the given unqualified symbol.
     *
     * @param symbolName symbol name to compare against the head
     * @return true if the head is an unqualified symbol with that name
     */
    public boolean startsWith(String symbolName) {
        return first() instanceof SymbolForm head
            && !head.isQualified()
            && head.name().equals(symbolName);
    }

    @Override
    public String toString() {
        return elements.stream().map(Form::toString).collect(Collectors.joining(" ", "(", ")"));
    }
}
