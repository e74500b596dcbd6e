package com.ram.script;

/** A .ram file name is malformed or the file cannot be read. */
public class RamFileException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RamFileException(String message) {
        super(message);
    }

    public RamFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
