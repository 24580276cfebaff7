package io.github.manjago.stackgp.genetic;

import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.MalformedProgramException;
import io.github.manjago.stackgp.core.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-program mutation.
 * <p>
 * One call applies exactly one mutation, chosen uniformly among the kinds that
 * are feasible for the program's length (INSERT below max length, DELETE above
 * min length, OPERAND when some instruction carries an operand). The caller
 * decides whether to mutate at all (once per offspring, with the mutation rate).
 * <p>
 * Jump targets follow the instructions they point at:
 * <ul>
 *   <li>insertion at {@code p}: targets {@code >= p} move by +1</li>
 *   <li>deletion at {@code p}: targets {@code > p} move by -1, a target equal to
 *       {@code p} now names the instruction that slid into {@code p}, and any target
 *       past the new end is clamped to the last instruction</li>
 * </ul>
 * Every result is re-validated; an invalid one is discarded and another random
 * choice is made, up to {@link #MAX_ATTEMPTS} times.
 */
public final class Mutator {

    private static final Logger log = LoggerFactory.getLogger(Mutator.class);

    /** Retry budget before giving up with {@link OperatorRepairException} */
    public static final int MAX_ATTEMPTS = 32;

    private final InstructionSampler sampler;
    private final ProgramShape shape;

    public Mutator(InstructionSampler sampler) {
        this.sampler = sampler;
        this.shape = sampler.getShape();
    }

    /**
     * Apply one random mutation.
     *
     * @return new valid program within the shape's length bounds
     * @throws OperatorRepairException if no valid mutant was found
     */
    public Program mutate(Program parent, GameRng rng) {
        MalformedProgramException lastFailure = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            List<MutationKind> feasible = feasibleKinds(parent);
            if (feasible.isEmpty()) {
                break;
            }
            MutationKind kind = feasible.get(rng.nextInt(feasible.size()));
            try {
                Program child = apply(kind, parent, rng);
                if (shape.acceptsLength(child.length())) {
                    return child;
                }
                log.debug("{} produced length {} outside bounds, retrying", kind, child.length());
            } catch (MalformedProgramException e) {
                lastFailure = e;
                log.debug("{} produced malformed program ({}), retrying", kind, e.getMessage());
            }
        }
        String message = "No valid mutant of " + parent.toShortString() + " after " + MAX_ATTEMPTS + " attempts";
        throw lastFailure != null
                ? new OperatorRepairException(message, lastFailure)
                : new OperatorRepairException(message);
    }

    List<MutationKind> feasibleKinds(Program program) {
        List<MutationKind> kinds = new ArrayList<>(4);
        int length = program.length();
        if (length > 0) {
            kinds.add(MutationKind.POINT);
        }
        if (length < shape.maxLength()) {
            kinds.add(MutationKind.INSERT);
        }
        if (length > shape.minLength()) {
            kinds.add(MutationKind.DELETE);
        }
        for (Instruction ins : program.instructions()) {
            if (ins.op().hasOperand()) {
                kinds.add(MutationKind.OPERAND);
                break;
            }
        }
        return kinds;
    }

    private Program apply(MutationKind kind, Program parent, GameRng rng) {
        int length = parent.length();
        return switch (kind) {
            case POINT -> {
                int pos = rng.nextInt(length);
                boolean hasOperand = parent.get(pos).op().hasOperand();
                yield replaceAt(parent, pos, sampler.randomWithArity(rng, hasOperand, length));
            }
            case INSERT -> {
                int pos = rng.nextInt(length + 1);
                yield insertAt(parent, pos, sampler.randomInstruction(rng, length + 1));
            }
            case DELETE -> deleteAt(parent, rng.nextInt(length));
            case OPERAND -> {
                List<Integer> candidates = new ArrayList<>();
                for (int i = 0; i < length; i++) {
                    if (parent.get(i).op().hasOperand()) {
                        candidates.add(i);
                    }
                }
                int pos = candidates.get(rng.nextInt(candidates.size()));
                Instruction ins = parent.get(pos);
                int operand = sampler.randomOperand(ins.op().getOperandKind(), rng, length);
                yield replaceAt(parent, pos, ins.withOperand(operand));
            }
        };
    }

    // ========== Deterministic edits ==========

    /**
     * Replace the instruction at {@code pos}. Targets are unaffected.
     */
    public static Program replaceAt(Program program, int pos, Instruction replacement) {
        List<Instruction> code = program.toMutableList();
        code.set(pos, replacement);
        return program.withInstructions(code);
    }

    /**
     * Insert before {@code pos} (or append when {@code pos == length}).
     * Existing targets at or past {@code pos} shift by +1; the inserted
     * instruction's own target is taken as given.
     */
    public static Program insertAt(Program program, int pos, Instruction inserted) {
        List<Instruction> code = new ArrayList<>(program.length() + 1);
        for (Instruction ins : program.instructions()) {
            if (ins.isJump() && ins.operand() >= pos) {
                code.add(ins.withOperand(ins.operand() + 1));
            } else {
                code.add(ins);
            }
        }
        code.add(pos, inserted);
        return program.withInstructions(code);
    }

    /**
     * Remove the instruction at {@code pos}, repairing targets as described
     * in the class documentation.
     */
    public static Program deleteAt(Program program, int pos) {
        int newLength = program.length() - 1;
        List<Instruction> code = new ArrayList<>(newLength);
        for (int i = 0; i < program.length(); i++) {
            if (i == pos) {
                continue;
            }
            Instruction ins = program.get(i);
            if (ins.isJump()) {
                int target = ins.operand();
                if (target > pos) {
                    target--;
                }
                target = Math.min(target, newLength - 1);
                code.add(ins.withOperand(target));
            } else {
                code.add(ins);
            }
        }
        return program.withInstructions(code);
    }
}
