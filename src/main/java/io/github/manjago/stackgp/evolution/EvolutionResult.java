package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.fitness.Evaluation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of a run.
 * 
 * @param bestProgram best program found; null only if the run was cancelled
 *                    before the first generation was evaluated
 * @param bestFitness its fitness, NaN if there is none
 * @param bestEvaluation its evaluation details
 * @param foundGeneration generation in which the best program was first reached
 * @param generations number of generations evaluated
 * @param reason why the run ended
 * @param seed effective random seed (replay with this to reproduce the run)
 * @param history per-generation statistics
 */
public record EvolutionResult(
    @Nullable Program bestProgram,
    double bestFitness,
    @Nullable Evaluation bestEvaluation,
    int foundGeneration,
    int generations,
    @NotNull TerminationReason reason,
    long seed,
    @NotNull List<GenerationStats> history
) {
    
    public EvolutionResult {
        history = List.copyOf(history);
    }
    
    public boolean isSolved() {
        return reason == TerminationReason.SOLVED;
    }
    
    public boolean hasProgram() {
        return bestProgram != null;
    }
    
    @Override
    public String toString() {
        return String.format("EvolutionResult[%s after %d generations, best=%.4f found in gen %d, seed=%d]",
                reason, generations, bestFitness, foundGeneration, seed);
    }
}
