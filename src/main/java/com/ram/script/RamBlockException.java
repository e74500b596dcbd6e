package com.ram.script;

/** A block variant was requested without the arguments it is built from. */
public class RamBlockException extends RamException {
    private static final long serialVersionUID = 1L;

    public RamBlockException(String detail) {
        super(detail);
    }
}
