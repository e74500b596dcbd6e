package com.ram.script;

/**
 * Root of every error raised by the Ram parser and evaluator.
 *
 * When the failing source line is known the message reads
 * {@code Line <n>: '<text>'} followed by an indented detail line.
 */
public class RamException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String line;
    private final int lineNumber;
    private final String detail;

    public RamException(String line, int lineNumber, String detail) {
        this(line, lineNumber, detail, null);
    }

    public RamException(String line, int lineNumber, String detail, Throwable cause) {
        super(format(line, lineNumber, detail), cause);
        this.line = line;
        this.lineNumber = lineNumber;
        this.detail = detail;
    }

    /** Evaluation-time error with no source line attached. */
    public RamException(String detail) {
        this(null, 0, detail, null);
    }

    public RamException(String detail, Throwable cause) {
        this(null, 0, detail, cause);
    }

    /** Source text of the failing line, or null. */
    public String line() { return line; }

    /** 1-based line number, or 0 when unknown. */
    public int lineNumber() { return lineNumber; }

    public String detail() { return detail; }

    static String format(String line, int lineNumber, String detail) {
        if (line == null) {
            return detail == null ? "Ram error" : detail;
        }
        String head = "Line " + lineNumber + ": '" + line + "'";
        return detail == null ? head : head + " \n     " + detail;
    }
}
