package com.nsscout.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A namespace declaration normalized to {@code (keyword symbol ...rest)}.
 *
 * <p>{@code (in-ns 'a.b)} and {@code (in-ns a.b)} both normalize to
 * {@code IN_NS a.b} with no rest; {@code (ns a.b "Doc." (:require x))} keeps the
 * docstring and the reference clause in {@link #rest()}.
 *
 * @param kind which declaration keyword headed the form
 * @param name namespace symbol, never null
 * @param rest remaining elements after the name, in source order
 */
public record NamespaceForm(NamespaceFormKind kind, SymbolForm name, List<Form> rest) {

    public NamespaceForm {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        rest = rest == null ? List.of() : List.copyOf(rest);
    }

    /**
     * Returns the namespace name as printed, e.g. {@code a.b}.
     *
     * @return namespace name
     */
    public String namespace() {
        return name.fullName();
    }

    /**
     * Rebuilds the canonical list form {@code (ns name ...rest)}.
     *
     * @return list form
     */
    public ListForm toForm() {
        List<Form> elements = new ArrayList<>(rest.size() + 2);
        elements.add(kind.symbol());
        elements.add(name);
        elements.addAll(rest);
        return new ListForm(elements);
    }

    @Override
    public String toString() {
        return toForm().toString();
    }
}
