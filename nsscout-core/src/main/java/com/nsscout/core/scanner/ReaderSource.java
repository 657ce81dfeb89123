package com.nsscout.core.scanner;

import java.io.IOException;
import java.io.Reader;

/**
 * Opens a fresh character stream over one source file or archive entry.
 *
 * <p>Each call must return a new reader; the caller closes it.
 */
@FunctionalInterface
public interface ReaderSource {

    Reader open() throws IOException;
}
