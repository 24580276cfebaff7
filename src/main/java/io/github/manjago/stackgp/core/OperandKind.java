package io.github.manjago.stackgp.core;

/**
 * Kind of the single operand an instruction may carry.
 * Fully determined by the opcode.
 */
public enum OperandKind {

    /** No operand. */
    NONE,

    /** Integer literal pushed onto the stack. */
    LITERAL,

    /** Variable bank slot index. */
    SLOT,

    /** Absolute instruction index inside the program. */
    TARGET;

    public boolean hasOperand() {
        return this != NONE;
    }
}
