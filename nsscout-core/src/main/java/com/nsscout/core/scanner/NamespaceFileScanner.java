package com.nsscout.core.scanner;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.FormReader;
import com.nsscout.core.reader.NamespaceFormExtractor;
import com.nsscout.core.reader.ReaderConfig;
import com.nsscout.core.reader.ReaderException;
import com.nsscout.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the namespace forms of one file or archive entry.
 *
 * <p>The reader is opened and closed inside {@link #scan(String, ReaderSource, ExtractionMode)}
 * whatever the outcome. Failures never escape as exceptions; they are reported through
 * {@link FileScanResult}.
 */
public class NamespaceFileScanner {

    private static final Logger log = LoggerFactory.getLogger(NamespaceFileScanner.class);

    private final ReaderConfig readerConfig;

    public NamespaceFileScanner(ReaderConfig readerConfig) {
        this.readerConfig = Objects.requireNonNull(readerConfig, "readerConfig must not be null");
    }

    /**
     * Scans a file on disk, read as UTF-8.
     *
     * @param file source file
     * @param mode first form only, or all forms
     * @return scan outcome
     */
    public FileScanResult scan(Path file, ExtractionMode mode) {
        return scan(file.toString(), () -> FileUtils.openSource(file), mode);
    }

    /**
     * Scans whatever {@code source} opens.
     *
     * @param sourceName name used in results and log messages
     * @param source opens the character stream
     * @param mode first form only, or all forms
     * @return scan outcome
     */
    public FileScanResult scan(String sourceName, ReaderSource source, ExtractionMode mode) {
        List<NamespaceForm> found = new ArrayList<>();
        try (Reader reader = source.open()) {
            NamespaceFormExtractor.extract(new FormReader(reader, readerConfig), mode, found::add);
            log.debug("Read {} namespace form(s) from {}", found.size(), sourceName);
            return FileScanResult.readable(sourceName, found);
        } catch (ReaderException e) {
            log.debug("Unreadable form in {}: {}", sourceName, e.getMessage());
            return FileScanResult.unreadable(sourceName, found, e);
        } catch (IOException e) {
            log.debug("Failed to read {}: {}", sourceName, e.getMessage());
            return FileScanResult.unreadable(sourceName, found, e);
        }
    }

    public ReaderConfig getReaderConfig() {
        return readerConfig;
    }
}
