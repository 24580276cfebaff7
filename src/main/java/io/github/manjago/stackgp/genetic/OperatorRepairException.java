package io.github.manjago.stackgp.genetic;

/**
 * A genetic operator could not produce a valid program within its retry budget.
 * Indicates a mismatch between operator and grammar, not a bad evolved program.
 */
public class OperatorRepairException extends IllegalStateException {

    public OperatorRepairException(String message) {
        super(message);
    }

    public OperatorRepairException(String message, Throwable cause) {
        super(message, cause);
    }
}
