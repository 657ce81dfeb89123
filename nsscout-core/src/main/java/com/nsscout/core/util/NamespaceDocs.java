package com.nsscout.core.util;

import com.nsscout.core.model.Form;
import com.nsscout.core.model.KeywordForm;
import com.nsscout.core.model.MapForm;
import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.model.NamespaceFormKind;
import com.nsscout.core.model.StringForm;

import java.util.List;
import java.util.Optional;

/**
 * Extracts namespace docstrings from unevaluated {@code ns} forms.
 *
 * <p>The result is what {@code (:doc (meta 'the.ns))} would return after the
 * declaration ran. The {@code ns} macro builds the name's metadata in three steps,
 * later steps winning:
 * <ol>
 *   <li>reader metadata on the name, {@code (ns ^{:doc "a"} x)}</li>
 *   <li>a docstring right after the name, {@code (ns x "b")}</li>
 *   <li>an attribute map after the name or docstring, {@code (ns x "b" {:doc "c"})}</li>
 * </ol>
 * Only that expansion is reproduced here; nothing is evaluated.
 */
public final class NamespaceDocs {

    private static final KeywordForm DOC_KEY = KeywordForm.of("doc");

    private NamespaceDocs() {
        // Utility class
    }

    /**
     * Returns the docstring the declaration would attach to its namespace.
     *
     * @param form namespace form
     * @return docstring, or empty for {@code in-ns} forms and declarations without one
     */
    public static Optional<String> docString(NamespaceForm form) {
        if (form.kind() != NamespaceFormKind.NS) {
            return Optional.empty();
        }
        return metadata(form).get(DOC_KEY)
            .filter(StringForm.class::isInstance)
            .map(doc -> ((StringForm) doc).value());
    }

    /**
     * Returns the metadata map the {@code ns} macro would leave on the namespace name.
     *
     * @param form namespace form
     * @return merged metadata, empty if none
     */
    public static MapForm metadata(NamespaceForm form) {
        MapForm meta = form.name().meta();
        List<Form> rest = form.rest();
        int index = 0;
        if (index < rest.size() && rest.get(index) instanceof StringForm docstring) {
            meta = meta.assoc(DOC_KEY, docstring);
            index++;
        }
        if (index < rest.size() && rest.get(index) instanceof MapForm attributes) {
            meta = meta.merge(attributes);
        }
        return meta;
    }
}
