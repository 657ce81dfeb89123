package com.nsscout.core;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.model.SymbolForm;
import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConfig;
import com.nsscout.core.scanner.ClasspathEntryScanner;
import com.nsscout.core.scanner.ClasspathResolver;
import com.nsscout.core.scanner.FileScanResult;
import com.nsscout.core.scanner.NamespaceFileScanner;
import com.nsscout.core.scanner.ScanContext;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.impl.DirectoryEntryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Finds namespace declarations in source files, directories, archives and whole classpaths
 * without loading or evaluating any code.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NamespaceFinder finder = NamespaceFinder.create();
 *
 * // every namespace under my.app on the JVM classpath
 * List<SymbolForm> namespaces = finder.namespacesOnClasspath(ScanContext.defaults().withPrefix("my.app"));
 *
 * // the ns form of one file
 * Optional<NamespaceForm> form = finder.namespaceFormInFile(Path.of("src/my/app/core.clj"));
 * }</pre>
 *
 * <p>Classpath entries are handed to the {@link ClasspathEntryScanner}s found with
 * {@link ServiceLoader}, lowest priority value first; entries no scanner accepts are
 * ignored. Results are concatenated in entry order.
 *
 * <p>Operations taking a {@code lenient} flag skip unreadable files when it is set
 * (the default) and throw {@link com.nsscout.core.scanner.UnreadableSourceException}
 * otherwise. A corrupt archive always fails with
 * {@link com.nsscout.core.scanner.CorruptArchiveException}.
 */
public class NamespaceFinder {

    private static final Logger log = LoggerFactory.getLogger(NamespaceFinder.class);

    private final ReaderConfig readerConfig;
    private final List<ClasspathEntryScanner> scanners;
    private final NamespaceFileScanner fileScanner;
    private final DirectoryEntryScanner directoryScanner = new DirectoryEntryScanner();

    /**
     * Creates a finder using the reader settings of the environment.
     *
     * @return finder
     */
    public static NamespaceFinder create() {
        return new NamespaceFinder(ReaderConfig.environment());
    }

    /**
     * Creates a finder with the entry scanners registered on the classpath.
     *
     * @param readerConfig reader settings for file-level operations and default contexts
     */
    public NamespaceFinder(ReaderConfig readerConfig) {
        this(readerConfig, discoverScanners());
    }

    /**
     * Creates a finder with explicit entry scanners.
     *
     * @param readerConfig reader settings for file-level operations and default contexts
     * @param scanners entry scanners, tried in priority order
     */
    public NamespaceFinder(ReaderConfig readerConfig, List<ClasspathEntryScanner> scanners) {
        this.readerConfig = Objects.requireNonNull(readerConfig, "readerConfig must not be null");
        List<ClasspathEntryScanner> sorted = new ArrayList<>(scanners);
        sorted.sort(Comparator.comparingInt(ClasspathEntryScanner::getPriority));
        this.scanners = List.copyOf(sorted);
        this.fileScanner = new NamespaceFileScanner(readerConfig);
    }

    // ==================== Files ====================

    /**
     * Reads the first namespace form of a file, skipping it if unreadable.
     *
     * @param file source file
     * @return first namespace form, or empty if there is none or the file is unreadable
     */
    public Optional<NamespaceForm> namespaceFormInFile(Path file) {
        return namespaceFormInFile(file, true);
    }

    /**
     * Reads the first namespace form of a file.
     *
     * @param file source file
     * @param lenient whether an unreadable file yields empty instead of failing
     * @return first namespace form, or empty if there is none
     * @throws com.nsscout.core.scanner.UnreadableSourceException if strict and the file is unreadable
     */
    public Optional<NamespaceForm> namespaceFormInFile(Path file, boolean lenient) {
        FileScanResult result = scanFile(file, ExtractionMode.FIRST_ONLY);
        if (!lenient) {
            result.formsOrThrow();
        }
        return result.firstForm();
    }

    public List<NamespaceForm> namespaceFormsInFile(Path file) {
        return namespaceFormsInFile(file, true);
    }

    /**
     * Reads every namespace form of a file, in file order.
     *
     * @param file source file
     * @param lenient whether an unreadable file yields the forms before the failure instead of failing
     * @return namespace forms
     * @throws com.nsscout.core.scanner.UnreadableSourceException if strict and the file is unreadable
     */
    public List<NamespaceForm> namespaceFormsInFile(Path file, boolean lenient) {
        FileScanResult result = scanFile(file, ExtractionMode.ALL);
        return lenient ? result.forms() : result.formsOrThrow();
    }

    /**
     * Scans one file and reports whether it was readable.
     *
     * @param file source file
     * @param mode first form only, or all forms
     * @return scan outcome, never throws for unreadable files
     */
    public FileScanResult scanFile(Path file, ExtractionMode mode) {
        return fileScanner.scan(file, mode);
    }

    // ==================== Directories ====================

    public List<NamespaceForm> namespaceFormsInDirectory(Path directory) {
        return namespaceFormsInDirectory(directory, true);
    }

    /**
     * Reads the first namespace form of every source file under a directory.
     *
     * @param directory root directory
     * @param lenient whether unreadable files are skipped
     * @return namespace forms in walk order, empty if the directory does not exist
     */
    public List<NamespaceForm> namespaceFormsInDirectory(Path directory, boolean lenient) {
        return directoryScanner.scan(directory, defaultContext().withLenient(lenient)).forms();
    }

    public List<SymbolForm> namespacesInDirectory(Path directory) {
        return namespacesInDirectory(directory, true);
    }

    public List<SymbolForm> namespacesInDirectory(Path directory, boolean lenient) {
        return names(namespaceFormsInDirectory(directory, lenient));
    }

    // ==================== Classpath entries ====================

    /**
     * Scans one classpath entry with the first scanner that accepts it.
     *
     * @param entry directory or archive
     * @param context scan settings
     * @return entry result, empty if no scanner accepts the entry
     */
    public ScanResult scanEntry(Path entry, ScanContext context) {
        for (ClasspathEntryScanner scanner : scanners) {
            if (scanner.appliesTo(entry)) {
                log.debug("Scanning {} with {}", entry, scanner.getId());
                return scanner.scan(entry, context);
            }
        }
        log.debug("No scanner applies to {}, ignoring", entry);
        return ScanResult.empty("none", entry.toString());
    }

    public List<NamespaceForm> namespaceFormsIn(String prefix, Path entry) {
        return namespaceFormsIn(prefix, entry, defaultContext());
    }

    /**
     * Reads the namespace forms of one classpath entry whose names start with {@code prefix}.
     *
     * @param prefix namespace prefix, or null for all
     * @param entry directory or archive
     * @param context scan settings; its own prefix is replaced by {@code prefix}
     * @return namespace forms
     */
    public List<NamespaceForm> namespaceFormsIn(String prefix, Path entry, ScanContext context) {
        return scanEntry(entry, context.withPrefix(prefix)).forms();
    }

    public List<SymbolForm> namespacesIn(String prefix, Path entry) {
        return names(namespaceFormsIn(prefix, entry));
    }

    public List<SymbolForm> namespacesIn(String prefix, Path entry, ScanContext context) {
        return names(namespaceFormsIn(prefix, entry, context));
    }

    // ==================== Classpaths ====================

    /**
     * Scans every entry of a classpath.
     *
     * @param classpath entries in order
     * @param context scan settings
     * @return one result per entry, in entry order
     */
    public List<ScanResult> scanClasspath(List<Path> classpath, ScanContext context) {
        log.debug("Scanning {} classpath entries", classpath.size());
        List<ScanResult> results = new ArrayList<>(classpath.size());
        for (Path entry : classpath) {
            results.add(scanEntry(entry, context));
        }
        return results;
    }

    /**
     * Reads the namespace forms on the classpath of the current thread's context class loader.
     *
     * @return namespace forms in entry order
     */
    public List<NamespaceForm> namespaceFormsOnClasspath() {
        return namespaceFormsOnClasspath(defaultContext());
    }

    public List<NamespaceForm> namespaceFormsOnClasspath(ScanContext context) {
        return forms(scanClasspath(currentClasspath(), context));
    }

    public List<NamespaceForm> namespaceFormsOnClasspath(String classpath, ScanContext context) {
        return forms(scanClasspath(ClasspathResolver.toPaths(classpath), context));
    }

    public List<NamespaceForm> namespaceFormsOnClasspath(Collection<?> classpath, ScanContext context) {
        return forms(scanClasspath(ClasspathResolver.toPaths(classpath), context));
    }

    /**
     * Lists the namespace names on the classpath of the current thread's context class loader.
     *
     * @return namespace symbols in entry order
     */
    public List<SymbolForm> namespacesOnClasspath() {
        return names(namespaceFormsOnClasspath());
    }

    public List<SymbolForm> namespacesOnClasspath(ScanContext context) {
        return names(namespaceFormsOnClasspath(context));
    }

    public List<SymbolForm> namespacesOnClasspath(String classpath, ScanContext context) {
        return names(namespaceFormsOnClasspath(classpath, context));
    }

    public List<SymbolForm> namespacesOnClasspath(Collection<?> classpath, ScanContext context) {
        return names(namespaceFormsOnClasspath(classpath, context));
    }

    // ==================== Accessors ====================

    public ReaderConfig getReaderConfig() {
        return readerConfig;
    }

    public List<ClasspathEntryScanner> getScanners() {
        return scanners;
    }

    /**
     * Lenient, first-form-only context with this finder's reader settings.
     *
     * @return default context
     */
    public ScanContext defaultContext() {
        return ScanContext.defaults(readerConfig);
    }

    private static List<Path> currentClasspath() {
        return ClasspathResolver.classpathOf(Thread.currentThread().getContextClassLoader());
    }

    private static List<NamespaceForm> forms(List<ScanResult> results) {
        return results.stream().flatMap(result -> result.forms().stream()).toList();
    }

    private static List<SymbolForm> names(List<NamespaceForm> forms) {
        return forms.stream().map(NamespaceForm::name).toList();
    }

    private static List<ClasspathEntryScanner> discoverScanners() {
        List<ClasspathEntryScanner> found = new ArrayList<>();
        ServiceLoader.load(ClasspathEntryScanner.class, NamespaceFinder.class.getClassLoader())
            .forEach(found::add);
        log.debug("Discovered {} entry scanner(s)", found.size());
        return found;
    }
}
