package com.nsscout.core.scanner;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.reader.ReaderException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of scanning a single source file or archive entry.
 *
 * <p>Either the file was read (possibly with no namespace forms), or it was
 * unreadable; an unreadable result still carries the forms found before the failure.
 * Callers that skip bad files use {@link #forms()}; callers that must not miss
 * anything use {@link #formsOrThrow()}.
 *
 * @param source file path or {@code archive!/entry} name
 * @param forms namespace forms found, in file order
 * @param error failure that stopped reading, or {@code null} if the file was read
 */
public record FileScanResult(String source, List<NamespaceForm> forms, Exception error) {

    public FileScanResult {
        Objects.requireNonNull(source, "source must not be null");
        forms = forms == null ? List.of() : List.copyOf(forms);
    }

    public static FileScanResult readable(String source, List<NamespaceForm> forms) {
        return new FileScanResult(source, forms, null);
    }

    public static FileScanResult unreadable(String source, List<NamespaceForm> formsBeforeError, Exception error) {
        return new FileScanResult(source, formsBeforeError, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean readable() {
        return error == null;
    }

    public Optional<NamespaceForm> firstForm() {
        return forms.isEmpty() ? Optional.empty() : Optional.of(forms.get(0));
    }

    /**
     * Returns the forms, failing if the file was unreadable.
     *
     * @return namespace forms
     * @throws UnreadableSourceException if the file could not be read
     */
    public List<NamespaceForm> formsOrThrow() {
        if (error != null) {
            throw new UnreadableSourceException(source, error);
        }
        return forms;
    }

    /**
     * Short classification of the failure for statistics: {@code syntax} for reader
     * errors, {@code io} for everything else.
     *
     * @return error type, or null if readable
     */
    public String errorType() {
        if (error == null) {
            return null;
        }
        return error instanceof ReaderException ? "syntax" : "io";
    }
}
