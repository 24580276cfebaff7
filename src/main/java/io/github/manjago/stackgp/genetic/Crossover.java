package io.github.manjago.stackgp.genetic;

import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Variable-length single-point crossover.
 * <p>
 * Cut points {@code c1} in the first parent and {@code c2} in the second are chosen
 * independently, giving children {@code A[0,c1) + B[c2,..)} and {@code B[0,c2) + A[c1,..)}.
 * <p>
 * Jump targets are remapped with the segment they travel in: a prefix keeps its
 * targets, a suffix moved from {@code c2} to {@code c1} has its targets shifted by
 * {@code c1 - c2}. A remapped target that falls outside the child is clamped to
 * the nearest valid index. Cut pairs producing a child outside the length bounds
 * are redrawn; after {@link #MAX_ATTEMPTS} the parents are returned unchanged.
 */
public final class Crossover {

    private static final Logger log = LoggerFactory.getLogger(Crossover.class);

    public static final int MAX_ATTEMPTS = 16;

    private final ProgramShape shape;

    public Crossover(ProgramShape shape) {
        this.shape = shape;
    }

    /**
     * Pair of children.
     *
     * @param first child starting with the first parent's prefix
     * @param second child starting with the second parent's prefix
     * @param recombined false when no admissible cut pair was found and the
     *                   children are the parents themselves
     */
    public record Offspring(Program first, Program second, boolean recombined) {}

    /**
     * Recombine two parents. Inputs are never modified.
     */
    public Offspring crossover(Program a, Program b, GameRng rng) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            int c1 = rng.nextInt(a.length() + 1);
            int c2 = rng.nextInt(b.length() + 1);
            int len1 = c1 + (b.length() - c2);
            int len2 = c2 + (a.length() - c1);
            if (shape.acceptsLength(len1) && shape.acceptsLength(len2)) {
                return new Offspring(splice(a, c1, b, c2), splice(b, c2, a, c1), true);
            }
        }
        log.debug("Crossover declined for lengths {} and {}", a.length(), b.length());
        return new Offspring(a, b, false);
    }

    /**
     * {@code head[0, headCut) + tail[tailCut, ..)} with target remapping.
     */
    public static Program splice(Program head, int headCut, Program tail, int tailCut) {
        int length = headCut + (tail.length() - tailCut);
        List<Instruction> code = new ArrayList<>(length);
        for (int i = 0; i < headCut; i++) {
            code.add(remap(head.get(i), 0, length));
        }
        int shift = headCut - tailCut;
        for (int i = tailCut; i < tail.length(); i++) {
            code.add(remap(tail.get(i), shift, length));
        }
        return head.withInstructions(code);
    }

    private static Instruction remap(Instruction ins, int shift, int length) {
        if (!ins.isJump()) {
            return ins;
        }
        int target = ins.operand() + shift;
        if (target < 0) {
            target = 0;
        } else if (target >= length) {
            target = length - 1;
        }
        return target == ins.operand() ? ins : ins.withOperand(target);
    }
}
