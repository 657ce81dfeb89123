package com.nsscout.core.scanner.impl;

import com.nsscout.core.scanner.CorruptArchiveException;
import com.nsscout.core.scanner.NamespaceScanException;
import com.nsscout.core.scanner.ScanContext;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.base.AbstractEntryScanner;
import com.nsscout.core.util.FileUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Scans {@code .jar} and {@code .zip} archives for {@code .clj} and {@code .cljc} entries.
 *
 * <p>Entries are read straight from the archive in entry order. The whole archive is
 * always scanned; a prefix then keeps only namespaces whose name starts with it,
 * compared as plain text. An archive that is not a valid zip file fails the scan even
 * when the context is lenient.
 */
public class ArchiveEntryScanner extends AbstractEntryScanner {

    private static final String SCANNER_ID = "archive";
    private static final String SCANNER_DISPLAY_NAME = "Archive Scanner";
    private static final int PRIORITY = 20;

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return SCANNER_DISPLAY_NAME;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean appliesTo(Path entry) {
        return FileUtils.isArchive(entry);
    }

    @Override
    public ScanResult scan(Path entry, ScanContext context) {
        try (ZipFile zipFile = new ZipFile(entry.toFile(), StandardCharsets.UTF_8)) {
            List<? extends ZipEntry> candidates = zipFile.stream()
                .filter(zipEntry -> !zipEntry.isDirectory())
                .filter(zipEntry -> FileUtils.isSourceFileName(zipEntry.getName()))
                .toList();
            log.debug("Found {} source entr(ies) in {}", candidates.size(), entry);

            Accumulator accumulator = new Accumulator(candidates.size());
            for (ZipEntry zipEntry : candidates) {
                scanCandidate(entry + "!/" + zipEntry.getName(),
                    () -> new BufferedReader(new InputStreamReader(zipFile.getInputStream(zipEntry), StandardCharsets.UTF_8)),
                    context, accumulator);
            }

            if (context.hasPrefix()) {
                String prefix = context.prefix();
                accumulator.retainForms(form -> form.namespace().startsWith(prefix));
            }
            return buildResult(entry, accumulator);
        } catch (ZipException e) {
            throw new CorruptArchiveException(entry, e);
        } catch (IOException e) {
            throw new NamespaceScanException("Failed to open archive: " + entry, e);
        }
    }
}
