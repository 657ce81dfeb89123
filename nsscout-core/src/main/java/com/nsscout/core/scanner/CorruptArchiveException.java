package com.nsscout.core.scanner;

import java.nio.file.Path;

/**
 * Thrown when a classpath archive is not a readable zip container.
 *
 * <p>Raised whether or not unreadable files are being skipped: a corrupt archive hides
 * every namespace it holds, not just one file.
 */
public class CorruptArchiveException extends NamespaceScanException {

    private final Path archive;

    public CorruptArchiveException(Path archive, Throwable cause) {
        super("archive file corrupt: " + archive, cause);
        this.archive = archive;
    }

    public Path getArchive() {
        return archive;
    }
}
