package com.ram.script;

/** An operator position held a token outside the recognised operator set. */
public class RamOperatorException extends RamSyntaxException {
    private static final long serialVersionUID = 1L;

    private final String foreign;

    public RamOperatorException(String line, int lineNumber, String foreign) {
        super(line, lineNumber, "Operator '" + foreign + "' invalid.");
        this.foreign = foreign;
    }

    public RamOperatorException(String foreign) {
        super("Operator '" + foreign + "' invalid.");
        this.foreign = foreign;
    }

    public String foreign() { return foreign; }
}
