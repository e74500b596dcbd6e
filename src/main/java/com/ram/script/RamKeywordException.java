package com.ram.script;

/** A required keyword was missing; carries the token found in its place. */
public class RamKeywordException extends RamSyntaxException {
    private static final long serialVersionUID = 1L;

    private final String foreign;

    public RamKeywordException(String line, int lineNumber, String foreign) {
        super(line, lineNumber, "Keyword '" + foreign + "' invalid.");
        this.foreign = foreign;
    }

    public String foreign() { return foreign; }
}
