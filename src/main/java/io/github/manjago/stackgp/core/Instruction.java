package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single instruction: opcode plus at most one operand.
 * <p>
 * Instructions without an operand always carry {@code 0} in {@link #operand()}.
 * Range checks that depend on the enclosing program (slot count, program length)
 * are done by {@link Program#of}.
 */
public record Instruction(@NotNull OpCode op, int operand) {

    public Instruction {
        Objects.requireNonNull(op, "op");
        if (!op.hasOperand() && operand != 0) {
            throw new MalformedProgramException(op.getMnemonic() + " takes no operand");
        }
    }

    /**
     * Instruction without operand.
     *
     * @throws MalformedProgramException if the opcode requires an operand
     */
    public static Instruction of(@NotNull OpCode op) {
        if (op.hasOperand()) {
            throw new MalformedProgramException(op.getMnemonic() + " requires a "
                    + op.getOperandKind().name().toLowerCase() + " operand");
        }
        return new Instruction(op, 0);
    }

    /**
     * Instruction with operand.
     *
     * @throws MalformedProgramException if the opcode takes no operand
     */
    public static Instruction of(@NotNull OpCode op, int operand) {
        if (!op.hasOperand()) {
            throw new MalformedProgramException(op.getMnemonic() + " takes no operand");
        }
        return new Instruction(op, operand);
    }

    public static Instruction push(int literal) {
        return of(OpCode.PUSH, literal);
    }

    public static Instruction load(int slot) {
        return of(OpCode.LOAD, slot);
    }

    public static Instruction store(int slot) {
        return of(OpCode.STORE, slot);
    }

    public static Instruction jmp(int target) {
        return of(OpCode.JMP, target);
    }

    public static Instruction jz(int target) {
        return of(OpCode.JZ, target);
    }

    public boolean isJump() {
        return op.isJump();
    }

    /**
     * Same opcode, different operand.
     */
    public Instruction withOperand(int newOperand) {
        return of(op, newOperand);
    }

    @Override
    public String toString() {
        return op.hasOperand() ? op.getMnemonic() + " " + operand : op.getMnemonic();
    }
}
