package com.kbdash.formula;

/**
 * Raised when a formula cannot be fully consumed by the grammar, or when a call's
 * arguments do not fit the function it names. No partial result accompanies it.
 */
public class FormulaSyntaxException extends RuntimeException {
    private final String reason;
    private final int position;
    private final String formula;

    public FormulaSyntaxException(String reason, int position, String formula) {
        super(reason + " at position " + position + " in formula: " + formula);
        this.reason = reason;
        this.position = position;
        this.formula = formula;
    }

    public String reason() {
        return reason;
    }

    public int position() {
        return position;
    }

    public String formula() {
        return formula;
    }
}
