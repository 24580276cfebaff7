package io.github.manjago.stackgp.genetic;

/**
 * Kinds of single-program mutation.
 */
public enum MutationKind {
    /** Replace one instruction with a fresh one of the same arity */
    POINT,
    /** Insert a fresh instruction */
    INSERT,
    /** Remove one instruction */
    DELETE,
    /** Resample the operand of one instruction */
    OPERAND
}
