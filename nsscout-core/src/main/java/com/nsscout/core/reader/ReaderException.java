package com.nsscout.core.reader;

/**
 * Thrown when the source text cannot be read as forms.
 *
 * <p>The message carries the position where reading stopped.
 */
public class ReaderException extends RuntimeException {

    private final int line;
    private final int column;

    public ReaderException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public ReaderException(String message, int line, int column, Throwable cause) {
        super(message + " (line " + line + ", column " + column + ")", cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
