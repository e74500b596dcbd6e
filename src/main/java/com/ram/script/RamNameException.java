package com.ram.script;

/** A variable or function name that is not bound in the environment. */
public class RamNameException extends RamException {
    private static final long serialVersionUID = 1L;

    private final String name;

    public RamNameException(String name) {
        super("Variable '" + name + "' not defined.");
        this.name = name;
    }

    protected RamNameException(String name, String detail) {
        super(detail);
        this.name = name;
    }

    /** The name is bound, but not to something that can be called with arguments. */
    public static RamNameException notCallable(String name) {
        return new RamNameException(name, "'" + name + "' is not a function.");
    }

    public String name() { return name; }
}
