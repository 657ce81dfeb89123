package com.nsscout.core.scanner;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.model.SymbolForm;

import java.util.List;
import java.util.Objects;

/**
 * Result of scanning one classpath entry.
 *
 * @param scannerId ID of the entry scanner that produced this result
 * @param entry the classpath entry that was scanned
 * @param forms namespace forms found, in traversal order
 * @param warnings unreadable files skipped in lenient mode
 * @param statistics file counts for the entry
 */
public record ScanResult(
    String scannerId,
    String entry,
    List<NamespaceForm> forms,
    List<String> warnings,
    ScanStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(scannerId, "scannerId must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        forms = forms == null ? List.of() : List.copyOf(forms);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    /**
     * Creates a result with no findings.
     *
     * @param scannerId scanner ID
     * @param entry scanned entry
     * @return empty result
     */
    public static ScanResult empty(String scannerId, String entry) {
        return new ScanResult(scannerId, entry, List.of(), List.of(), ScanStatistics.empty());
    }

    public boolean hasFindings() {
        return !forms.isEmpty();
    }

    /**
     * Returns just the namespace names of the forms.
     *
     * @return namespace symbols in result order
     */
    public List<SymbolForm> namespaces() {
        return forms.stream().map(NamespaceForm::name).toList();
    }
}
