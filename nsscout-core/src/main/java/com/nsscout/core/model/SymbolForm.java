package com.nsscout.core.model;

import java.util.Objects;

/**
 * A symbol, optionally namespace-qualified ({@code clojure.string/join}).
 *
 * <p>Reader metadata attached with {@code ^} is kept in {@link #meta()} but does not
 * take part in {@link #equals(Object)} or {@link #hashCode()}.
 *
 * @param namespace namespace part, or {@code null} for an unqualified symbol
 * @param name name part
 * @param meta reader metadata, empty when none was attached
 */
public record SymbolForm(String namespace, String name, MapForm meta) implements Form {

    public SymbolForm {
        Objects.requireNonNull(name, "name must not be null");
        if (meta == null) {
            meta = MapForm.EMPTY;
        }
    }

    /**
     * Creates a symbol from its printed text, splitting on the first {@code /}.
     *
     * @param text symbol text such as {@code a.b} or {@code clojure.core/ns}
     * @return symbol without metadata
     */
    public static SymbolForm of(String text) {
        int slash = text.indexOf('/');
        if (slash <= 0 || text.equals("/")) {
            return new SymbolForm(null, text, MapForm.EMPTY);
        }
        return new SymbolForm(text.substring(0, slash), text.substring(slash + 1), MapForm.EMPTY);
    }

    public SymbolForm withMeta(MapForm newMeta) {
        return new SymbolForm(namespace, name, newMeta);
    }

    public boolean isQualified() {
        return namespace != null;
    }

    /**
     * Returns the printed name including the namespace part, if any.
     *
     * @return full symbol name
     */
    public String fullName() {
        return namespace == null ? name : namespace + "/" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolForm other)) {
            return false;
        }
        return Objects.equals(namespace, other.namespace) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
