package com.nsscout.core.model;

import java.util.Objects;

/**
 * A reader conditional kept unevaluated, produced only when the reader runs in
 * preserve mode.
 *
 * @param splicing whether it was written {@code #?@}
 * @param branches alternating feature keywords and branch forms
 */
public record ReaderConditionalForm(boolean splicing, ListForm branches) implements Form {

    public ReaderConditionalForm {
        Objects.requireNonNull(branches, "branches must not be null");
    }

    @Override
    public String toString() {
        return (splicing ? "#?@" : "#?") + branches;
    }
}
