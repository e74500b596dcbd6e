package com.ram.script;

/** Malformed line or header: wrong token count, unbalanced brackets, unparsable form. */
public class RamSyntaxException extends RamException {
    private static final long serialVersionUID = 1L;

    public RamSyntaxException(String line, int lineNumber, String detail) {
        super(line, lineNumber, detail);
    }

    public RamSyntaxException(String detail) {
        super(detail);
    }
}
