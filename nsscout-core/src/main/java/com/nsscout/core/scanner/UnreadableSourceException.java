package com.nsscout.core.scanner;

/**
 * Thrown in strict mode when a source file cannot be read as forms.
 */
public class UnreadableSourceException extends NamespaceScanException {

    private final String source;

    public UnreadableSourceException(String source, Throwable cause) {
        super("Unreadable source file: " + source + " (" + cause.getMessage() + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
