package com.nsscout.core.scanner;

import java.nio.file.Path;

/**
 * Scans one kind of classpath entry (a directory tree, an archive) for namespace forms.
 *
 * <p>Implementations are discovered via Java Service Provider Interface (SPI) and tried
 * in priority order (lower numbers first); the first one whose {@link #appliesTo(Path)}
 * accepts an entry scans it. Entries no scanner accepts contribute nothing.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.nsscout.core.scanner.ClasspathEntryScanner}
 *
 * @see ScanContext
 * @see ScanResult
 */
public interface ClasspathEntryScanner {

    /**
     * Returns unique identifier for this scanner, in kebab-case.
     *
     * @return unique scanner identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this scanner.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns execution priority; lower values are tried first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Checks whether this scanner handles the given classpath entry.
     *
     * @param entry classpath entry
     * @return true if this scanner should scan it
     */
    boolean appliesTo(Path entry);

    /**
     * Scans the entry.
     *
     * <p>Unreadable source files are skipped and reported in the result when
     * {@link ScanContext#lenient()} is set, and raise {@link UnreadableSourceException}
     * otherwise.
     *
     * @param entry classpath entry accepted by {@link #appliesTo(Path)}
     * @param context scan settings
     * @return namespace forms found in the entry
     * @throws NamespaceScanException if the entry itself cannot be scanned
     */
    ScanResult scan(Path entry, ScanContext context);
}
