package com.nsscout.core.scanner.base;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.scanner.ClasspathEntryScanner;
import com.nsscout.core.scanner.FileScanResult;
import com.nsscout.core.scanner.NamespaceFileScanner;
import com.nsscout.core.scanner.ReaderSource;
import com.nsscout.core.scanner.ScanContext;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.ScanStatistics;
import com.nsscout.core.scanner.UnreadableSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Abstract base class for entry scanners providing common functionality.
 *
 * <p>This class reduces code duplication across entry scanners by providing:
 * <ul>
 *   <li>Logger initialization (one logger per scanner class)</li>
 *   <li>The lenient/strict policy for unreadable candidates ({@link #scanCandidate})</li>
 *   <li>ScanResult creation helpers ({@link #emptyResult(Path)}, {@link #buildResult})</li>
 * </ul>
 *
 * <p>Concrete scanners list the candidates of their entry, call
 * {@link #scanCandidate} for each with a shared {@link Accumulator}, and finish with
 * {@link #buildResult}.
 *
 * @see ClasspathEntryScanner
 */
public abstract class AbstractEntryScanner implements ClasspathEntryScanner {

    /**
     * Logger instance for this scanner.
     * Automatically initialized with the concrete scanner class name.
     */
    protected final Logger log;

    protected AbstractEntryScanner() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Scans one candidate file and adds its outcome to {@code accumulator}.
     *
     * <p>Forms of an unreadable candidate that were read before the failure are kept
     * in lenient mode.
     *
     * @param sourceName file path or archive entry name
     * @param source opens the candidate
     * @param context scan settings
     * @param accumulator collects forms, warnings and statistics for the entry
     * @throws UnreadableSourceException if the candidate is unreadable and the scan is strict
     */
    protected void scanCandidate(String sourceName, ReaderSource source, ScanContext context,
                                 Accumulator accumulator) {
        NamespaceFileScanner fileScanner = new NamespaceFileScanner(context.readerConfig());
        FileScanResult result = fileScanner.scan(sourceName, source, context.extractionMode());
        accumulator.statistics.incrementFilesScanned();

        if (!result.readable()) {
            if (!context.lenient()) {
                throw new UnreadableSourceException(sourceName, result.error());
            }
            accumulator.statistics.incrementFilesUnreadable();
            accumulator.statistics.addError(result.errorType(), sourceName + ": " + result.error().getMessage());
            accumulator.warnings.add("Skipped unreadable file " + sourceName + ": " + result.error().getMessage());
            log.debug("Skipping unreadable file {}: {}", sourceName, result.error().getMessage());
        }

        if (!result.forms().isEmpty()) {
            accumulator.statistics.incrementFilesWithNamespaces();
            accumulator.forms.addAll(result.forms());
        }
    }

    /**
     * Creates an empty ScanResult for this scanner.
     *
     * @param entry scanned entry
     * @return empty result with this scanner's ID
     */
    protected ScanResult emptyResult(Path entry) {
        return ScanResult.empty(getId(), entry.toString());
    }

    /**
     * Creates the result of an entry scan, logging a summary.
     *
     * @param entry scanned entry
     * @param accumulator collected outcome
     * @return scan result with this scanner's ID
     */
    protected ScanResult buildResult(Path entry, Accumulator accumulator) {
        ScanStatistics statistics = accumulator.statistics.build();
        if (statistics.hasFailures()) {
            log.warn("Skipped {} unreadable file(s) in {}", statistics.filesUnreadable(), entry);
        }
        log.info("Found {} namespace form(s) in {} ({})", accumulator.forms.size(), entry, statistics.getSummary());
        return new ScanResult(getId(), entry.toString(), accumulator.forms, accumulator.warnings, statistics);
    }

    /**
     * Mutable per-entry collector; one instance per {@code scan} call.
     */
    protected static final class Accumulator {
        private final List<NamespaceForm> forms = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final ScanStatistics.Builder statistics = new ScanStatistics.Builder();

        public Accumulator(int filesDiscovered) {
            statistics.filesDiscovered(filesDiscovered);
        }

        public List<NamespaceForm> forms() {
            return forms;
        }

        /**
         * Keeps only the forms accepted by {@code filter}.
         *
         * @param filter form predicate
         */
        public void retainForms(Predicate<NamespaceForm> filter) {
            forms.removeIf(filter.negate());
        }
    }
}
