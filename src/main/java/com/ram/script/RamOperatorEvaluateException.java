package com.ram.script;

/** Arithmetic or conversion attempted on operands of the wrong runtime type. */
public class RamOperatorEvaluateException extends RamException {
    private static final long serialVersionUID = 1L;

    public RamOperatorEvaluateException(String left, String operator, String right) {
        super("Operator '" + operator + "' cannot be applied to " + left + " and " + right + ".");
    }

    public RamOperatorEvaluateException(String detail) {
        super(detail);
    }
}
