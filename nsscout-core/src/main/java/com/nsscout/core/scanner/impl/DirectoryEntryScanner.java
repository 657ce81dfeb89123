package com.nsscout.core.scanner.impl;

import com.nsscout.core.scanner.NamespaceScanException;
import com.nsscout.core.scanner.ScanContext;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.base.AbstractEntryScanner;
import com.nsscout.core.util.FileUtils;
import com.nsscout.core.util.NamespacePaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Scans a source directory tree for {@code .clj} and {@code .cljc} files.
 *
 * <p>With a prefix, only the subdirectory the prefix maps to is walked
 * ({@code my-app.web} becomes {@code root/my_app/web}); a missing subdirectory
 * yields an empty result. Files are scanned in walk order, unsorted.
 */
public class DirectoryEntryScanner extends AbstractEntryScanner {

    private static final String SCANNER_ID = "directory";
    private static final String SCANNER_DISPLAY_NAME = "Source Directory Scanner";
    private static final int PRIORITY = 10;

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
        return Files.isDirectory(entry);
    }

    @Override
    public ScanResult scan(Path entry, ScanContext context) {
        Path root = context.hasPrefix()
            ? entry.resolve(NamespacePaths.prefixDirectory(context.prefix()))
            : entry;

        if (!Files.isDirectory(root)) {
            log.debug("Nothing to scan under {}", root);
            return emptyResult(entry);
        }

        List<Path> files;
        try {
            files = FileUtils.findSourceFiles(root);
        } catch (IOException e) {
            throw new NamespaceScanException("Failed to walk directory: " + root, e);
        }
        log.debug("Found {} source file(s) under {}", files.size(), root);

        Accumulator accumulator = new Accumulator(files.size());
        for (Path file : files) {
            scanCandidate(file.toString(), () -> FileUtils.openSource(file),
                context, accumulator);
        }
        return buildResult(entry, accumulator);
    }
}
