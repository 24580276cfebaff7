package io.github.manjago.stackgp.genetic;

import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.OpCode;
import io.github.manjago.stackgp.core.OperandKind;
import io.github.manjago.stackgp.core.Program;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Draws random valid instructions and programs.
 * <p>
 * Opcodes are uniform over the allowed set. LOAD/STORE are dropped when the
 * variable bank is empty; JMP/JZ are dropped when jumps are disabled or the
 * target program would be empty.
 */
public final class InstructionSampler {

    private final ProgramShape shape;
    private final List<OpCode> opcodes;
    private final List<OpCode> jumpFreeOpcodes;

    public InstructionSampler(ProgramShape shape) {
        this.shape = shape;
        List<OpCode> allowed = new ArrayList<>();
        for (OpCode op : OpCode.values()) {
            if (op.getOperandKind() == OperandKind.SLOT && shape.variableSlots() == 0) {
                continue;
            }
            if (op.isJump() && !shape.allowJumps()) {
                continue;
            }
            allowed.add(op);
        }
        this.opcodes = List.copyOf(allowed);
        this.jumpFreeOpcodes = opcodes.stream().filter(OpCode.jumpFree()::contains).toList();
    }

    public ProgramShape getShape() {
        return shape;
    }

    /**
     * Random instruction valid inside a program of the given length.
     */
    public Instruction randomInstruction(GameRng rng, int programLength) {
        List<OpCode> pool = programLength > 0 ? opcodes : jumpFreeOpcodes;
        return randomInstruction(pool.get(rng.nextInt(pool.size())), rng, programLength);
    }

    /**
     * Random instruction that carries an operand iff {@code hasOperand}.
     */
    public Instruction randomWithArity(GameRng rng, boolean hasOperand, int programLength) {
        List<OpCode> pool = (programLength > 0 ? opcodes : jumpFreeOpcodes).stream()
                .filter(op -> op.hasOperand() == hasOperand)
                .toList();
        if (pool.isEmpty()) {
            return randomInstruction(rng, programLength);
        }
        return randomInstruction(pool.get(rng.nextInt(pool.size())), rng, programLength);
    }

    private Instruction randomInstruction(OpCode op, GameRng rng, int programLength) {
        if (!op.hasOperand()) {
            return Instruction.of(op);
        }
        return Instruction.of(op, randomOperand(op.getOperandKind(), rng, programLength));
    }

    /**
     * Random operand of the given kind.
     *
     * @param programLength length of the program the operand will live in
     */
    public int randomOperand(OperandKind kind, GameRng rng, int programLength) {
        return switch (kind) {
            case LITERAL -> rng.nextIntInclusive(shape.literalMin(), shape.literalMax());
            case SLOT -> rng.nextInt(shape.variableSlots());
            case TARGET -> rng.nextInt(programLength);
            case NONE -> 0;
        };
    }

    /**
     * Random program with a length drawn uniformly from the shape's bounds.
     */
    public Program randomProgram(GameRng rng) {
        int length = rng.nextIntInclusive(shape.minLength(), shape.maxLength());
        Instruction[] code = new Instruction[length];
        for (int i = 0; i < length; i++) {
            code[i] = randomInstruction(rng, length);
        }
        return Program.of(Arrays.asList(code), shape.variableSlots());
    }
}
