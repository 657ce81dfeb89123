package com.nsscout.core.model;

import java.util.Objects;

/**
 * A keyword such as {@code :doc}, {@code :clojure.core/ns} or {@code ::local}.
 *
 * <p>Auto-resolved keywords ({@code ::name}, {@code ::alias/name}) are kept unresolved
 * with {@code autoResolved} set, since resolving them needs the namespace environment.
 *
 * @param namespace namespace or alias part, or {@code null}
 * @param name name part
 * @param autoResolved whether the keyword was written with a leading {@code ::}
 */
public record KeywordForm(String namespace, String name, boolean autoResolved) implements Form {

    public KeywordForm {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a plain unqualified keyword.
     *
     * @param name keyword name without the colon
     * @return keyword
     */
    public static KeywordForm of(String name) {
        return new KeywordForm(null, name, false);
    }

    @Override
    public String toString() {
        String prefix = autoResolved ? "::" : ":";
        return namespace == null ? prefix + name : prefix + namespace + "/" + name;
    }
}
