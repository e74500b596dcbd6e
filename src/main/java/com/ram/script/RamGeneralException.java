package com.ram.script;

/** Wraps any otherwise unclassified failure, keeping the original message and cause. */
public class RamGeneralException extends RamException {
    private static final long serialVersionUID = 1L;

    public RamGeneralException(String detail) {
        super(detail);
    }

    public RamGeneralException(Throwable cause) {
        super(cause.getMessage() == null ? cause.toString() : cause.getMessage(), cause);
    }
}
