package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable, validated instruction sequence.
 * <p>
 * Invariants checked on construction:
 * <ul>
 *   <li>every SLOT operand is in {@code [0, variableSlots)}</li>
 *   <li>every TARGET operand is in {@code [0, length)}</li>
 * </ul>
 * Genetic operators build new programs instead of editing existing ones, so a
 * program can be shared freely between evaluation threads.
 */
public final class Program {

    /** Variable bank size used when none is configured */
    public static final int DEFAULT_VARIABLE_SLOTS = 4;

    private final List<Instruction> instructions;
    private final int variableSlots;

    private Program(List<Instruction> instructions, int variableSlots) {
        this.instructions = instructions;
        this.variableSlots = variableSlots;
    }

    /**
     * Validate and build a program.
     *
     * @param instructions instruction sequence (copied)
     * @param variableSlots size of the variable bank the program runs against
     * @throws MalformedProgramException if any operand is out of range
     */
    public static Program of(@NotNull List<Instruction> instructions, int variableSlots) {
        if (variableSlots < 0) {
            throw new MalformedProgramException("Negative variable bank size: " + variableSlots);
        }
        List<Instruction> copy = List.copyOf(instructions);
        int length = copy.size();
        for (int i = 0; i < length; i++) {
            Instruction ins = copy.get(i);
            int operand = ins.operand();
            switch (ins.op().getOperandKind()) {
                case SLOT -> {
                    if (operand < 0 || operand >= variableSlots) {
                        throw new MalformedProgramException(
                                "slot " + operand + " outside variable bank [0, " + variableSlots + ")", i);
                    }
                }
                case TARGET -> {
                    if (operand < 0 || operand >= length) {
                        throw new MalformedProgramException(
                                "jump target " + operand + " outside program [0, " + length + ")", i);
                    }
                }
                default -> {
                    // LITERAL and NONE have no program-dependent range
                }
            }
        }
        return new Program(copy, variableSlots);
    }

    public static Program of(int variableSlots, Instruction... instructions) {
        return of(Arrays.asList(instructions), variableSlots);
    }

    /**
     * New program with the same variable bank, validated like {@link #of(List, int)}.
     */
    public Program withInstructions(@NotNull List<Instruction> replacement) {
        return of(replacement, variableSlots);
    }

    /**
     * Skips range checks. Only for exercising the VM's runtime guards.
     */
    static Program unchecked(List<Instruction> instructions, int variableSlots) {
        return new Program(List.copyOf(instructions), variableSlots);
    }

    // ========== Access ==========

    public int length() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }

    /**
     * @return unmodifiable view of the instructions
     */
    public List<Instruction> instructions() {
        return instructions;
    }

    /**
     * @return mutable copy, convenient for operators building a new program
     */
    public List<Instruction> toMutableList() {
        return new ArrayList<>(instructions);
    }

    public int variableSlots() {
        return variableSlots;
    }

    public boolean hasJumps() {
        for (Instruction ins : instructions) {
            if (ins.isJump()) {
                return true;
            }
        }
        return false;
    }

    // ========== Object methods ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Program other)) return false;
        return variableSlots == other.variableSlots && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return 31 * instructions.hashCode() + variableSlots;
    }

    /**
     * Text form, one instruction per line.
     */
    @Override
    public String toString() {
        return Disassembler.disassemble(this);
    }

    /**
     * Single-line form for logs, e.g. {@code [PUSH 1, ADD, HALT]}.
     */
    public String toShortString() {
        return instructions.toString();
    }
}
