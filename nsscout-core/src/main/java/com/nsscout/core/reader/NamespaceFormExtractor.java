package com.nsscout.core.reader;

import com.nsscout.core.model.Form;
import com.nsscout.core.model.ListForm;
import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.model.NamespaceFormKind;
import com.nsscout.core.model.SymbolForm;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Picks the namespace declarations out of a file's top-level forms.
 *
 * <p>A top-level list whose head is the unqualified symbol {@code ns} or {@code in-ns}
 * and whose second element is a symbol becomes a {@link NamespaceForm}. A quoted
 * {@code in-ns} argument is unwrapped, so {@code (in-ns 'a.b)} and {@code (ns a.b)}
 * both carry the plain symbol {@code a.b}. Declarations without a symbol name, such
 * as {@code (in-ns (symbol "x"))}, are skipped.
 */
public final class NamespaceFormExtractor {

    private NamespaceFormExtractor() {
        // Utility class
    }

    /**
     * Reads forms until the mode is satisfied or the stream ends, passing each
     * namespace form to {@code sink} as soon as it is found.
     *
     * <p>Forms found before a {@link ReaderException} have already been delivered
     * when the exception propagates.
     *
     * @param reader form reader positioned at the start of the file
     * @param mode stop after the first form, or read everything
     * @param sink receives namespace forms in file order
     * @return number of namespace forms delivered
     * @throws IOException if the underlying reader fails
     * @throws ReaderException if a malformed form is reached before the mode is satisfied
     */
    public static int extract(FormReader reader, ExtractionMode mode, Consumer<NamespaceForm> sink)
            throws IOException {
        int found = 0;
        Optional<Form> form = reader.read();
        while (form.isPresent()) {
            Optional<NamespaceForm> namespaceForm = toNamespaceForm(form.get());
            if (namespaceForm.isPresent()) {
                sink.accept(namespaceForm.get());
                found++;
                if (mode.isSatisfiedBy(found)) {
                    break;
                }
            }
            form = reader.read();
        }
        return found;
    }

    /**
     * Collects the namespace forms of a file into a list.
     *
     * @param reader form reader positioned at the start of the file
     * @param mode stop after the first form, or read everything
     * @return namespace forms in file order
     * @throws IOException if the underlying reader fails
     * @throws ReaderException if a malformed form is reached before the mode is satisfied
     */
    public static List<NamespaceForm> extract(FormReader reader, ExtractionMode mode) throws IOException {
        List<NamespaceForm> forms = new ArrayList<>();
        extract(reader, mode, forms::add);
        return forms;
    }

    /**
     * Normalizes one top-level form into a namespace form.
     *
     * @param form any form
     * @return the namespace form, or empty if {@code form} is not a declaration with a symbol name
     */
    public static Optional<NamespaceForm> toNamespaceForm(Form form) {
        if (!(form instanceof ListForm list) || list.size() < 2) {
            return Optional.empty();
        }
        Optional<NamespaceFormKind> kind = NamespaceFormKind.fromHead(list.first());
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        Form name = list.get(1);
        if (kind.get() == NamespaceFormKind.IN_NS) {
            name = unquote(name);
        }
        if (!(name instanceof SymbolForm symbol)) {
            return Optional.empty();
        }
        return Optional.of(new NamespaceForm(kind.get(), symbol, list.elements().subList(2, list.size())));
    }

    private static Form unquote(Form form) {
        if (form instanceof ListForm quoted && quoted.size() == 2 && quoted.startsWith("quote")) {
            return quoted.get(1);
        }
        return form;
    }
}
