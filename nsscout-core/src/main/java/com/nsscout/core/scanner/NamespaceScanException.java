package com.nsscout.core.scanner;

/**
 * Fatal scanning failure that aborts the whole scan.
 */
public class NamespaceScanException extends RuntimeException {

    public NamespaceScanException(String message) {
        super(message);
    }

    public NamespaceScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
