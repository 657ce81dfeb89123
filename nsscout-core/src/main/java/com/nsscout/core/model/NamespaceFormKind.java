package com.nsscout.core.model;

import java.util.Optional;

/**
 * The two top-level forms that name the namespace of a file.
 */
public enum NamespaceFormKind {
    /** {@code (ns name ...)}: declares and configures a namespace. */
    NS("ns"),
    /** {@code (in-ns 'name)}: switches the current namespace. */
    IN_NS("in-ns");

    private final String symbolName;

    NamespaceFormKind(String symbolName) {
        this.symbolName = symbolName;
    }

    public String symbolName() {
        return symbolName;
    }

    public SymbolForm symbol() {
        return SymbolForm.of(symbolName);
    }

    /**
     * Looks up the kind for the head of a list form. Only unqualified symbols match.
     *
     * @param head first element of a list form, may be null
     * @return matching kind, or empty
     */
    public static Optional<NamespaceFormKind> fromHead(Form head) {
        if (!(head instanceof SymbolForm symbol) || symbol.isQualified()) {
            return Optional.empty();
        }
        for (NamespaceFormKind kind : values()) {
            if (kind.symbolName.equals(symbol.name())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
