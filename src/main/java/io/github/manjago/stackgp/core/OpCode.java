package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Instruction Set Architecture (ISA) v1.0
 * <p>
 * A closed set of stack-machine operations. Each opcode fixes the kind of its
 * operand (see {@link OperandKind}), so an instruction is valid or invalid as a whole.
 * New opcodes are added as new constants with a bumped {@link #ISA_VERSION};
 * existing codes never change.
 * <p>
 * Binary operations pop {@code b} (top) then {@code a} and push {@code a op b}.
 */
public enum OpCode {

    // ========== Stack ==========

    /** Push literal. */
    PUSH(0x01, OperandKind.LITERAL, "PUSH"),

    /** Discard top of stack. */
    POP(0x02, OperandKind.NONE, "POP"),

    /** Duplicate top of stack. */
    DUP(0x03, OperandKind.NONE, "DUP"),

    /** Swap two topmost values. */
    SWAP(0x04, OperandKind.NONE, "SWAP"),

    // ========== Arithmetic ==========

    /** a + b (wrapping) */
    ADD(0x10, OperandKind.NONE, "ADD"),

    /** a - b (wrapping) */
    SUB(0x11, OperandKind.NONE, "SUB"),

    /** a * b (wrapping) */
    MUL(0x12, OperandKind.NONE, "MUL"),

    /** a / b, truncated toward zero. Division by zero faults. */
    DIV(0x13, OperandKind.NONE, "DIV"),

    // ========== Variables ==========

    /** Push variable slot. */
    LOAD(0x20, OperandKind.SLOT, "LOAD"),

    /** Pop into variable slot. */
    STORE(0x21, OperandKind.SLOT, "STORE"),

    // ========== Control Flow ==========

    /** Unconditional jump. IP = target */
    JMP(0x30, OperandKind.TARGET, "JMP"),

    /** Pop condition, jump if it is zero. */
    JZ(0x31, OperandKind.TARGET, "JZ"),

    /** Stop execution. */
    HALT(0x3F, OperandKind.NONE, "HALT");

    /** Bumped whenever opcodes are added. */
    public static final int ISA_VERSION = 1;

    // ========== Fields & Constructor ==========

    private final int code;
    private final OperandKind operandKind;
    private final String mnemonic;

    OpCode(int code, OperandKind operandKind, String mnemonic) {
        this.code = code;
        this.operandKind = operandKind;
        this.mnemonic = mnemonic;
    }

    public int getCode() {
        return code;
    }

    public OperandKind getOperandKind() {
        return operandKind;
    }

    public boolean hasOperand() {
        return operandKind.hasOperand();
    }

    public boolean isJump() {
        return operandKind == OperandKind.TARGET;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    // ========== Lookup ==========

    private static final List<OpCode> JUMP_FREE = Arrays.stream(values())
            .filter(op -> !op.isJump())
            .toList();

    /**
     * Find OpCode by mnemonic (case-insensitive).
     * @return OpCode or null if not found
     */
    @Contract(pure = true)
    public static @Nullable OpCode fromMnemonic(String mnemonic) {
        for (OpCode op : values()) {
            if (op.mnemonic.equalsIgnoreCase(mnemonic)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Opcodes without a jump target, for configurations that disable control flow.
     */
    public static List<OpCode> jumpFree() {
        return JUMP_FREE;
    }
}
