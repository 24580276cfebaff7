package io.github.manjago.stackgp.persistence;

import io.github.manjago.stackgp.evolution.TerminationReason;
import org.jetbrains.annotations.Nullable;

/**
 * One archived run as read back from a {@link ResultStore}.
 *
 * @param id run number within the file, starting at 1
 * @param problem problem name
 * @param reason termination reason
 * @param seed effective seed of the run
 * @param bestFitness best fitness, NaN if none
 * @param foundGeneration generation the best program was found in
 * @param generations generations evaluated
 * @param programText best program in assembler text form, null if none
 * @param bestFitnessHistory best fitness per generation
 * @param timestamp epoch millis when the run was saved
 */
public record StoredRun(
    int id,
    String problem,
    TerminationReason reason,
    long seed,
    double bestFitness,
    int foundGeneration,
    int generations,
    @Nullable String programText,
    double[] bestFitnessHistory,
    long timestamp
) {

    @Override
    public String toString() {
        return String.format("Run #%d [%s] %s after %d generations, best=%.4f (gen %d), seed=%d",
                id, problem, reason, generations, bestFitness, foundGeneration, seed);
    }
}
