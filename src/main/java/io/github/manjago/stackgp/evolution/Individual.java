package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.fitness.Evaluation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * A candidate program in the population.
 * 
 * Each individual has:
 * - An immutable program
 * - Its evaluation (absent until scored)
 * - The generation it was born in
 * - A run-unique id, used as the final tie-breaker when ranking
 * 
 * Programs never change after birth; a mutated program always becomes a new
 * individual without fitness.
 */
public final class Individual {
    
    /**
     * Best first: higher fitness, then shorter program, then older id.
     * Only for evaluated individuals.
     */
    public static final Comparator<Individual> BEST_FIRST = Comparator
            .comparingDouble(Individual::getFitness).reversed()
            .thenComparingInt(i -> i.program.length())
            .thenComparingLong(Individual::getId);
    
    private final long id;
    private final Program program;
    private final int birthGeneration;
    private volatile Evaluation evaluation;
    
    /**
     * Create a new, unevaluated individual.
     * 
     * @param id unique identifier within the run
     * @param program genome
     * @param birthGeneration generation in which it was created
     */
    public Individual(long id, @NotNull Program program, int birthGeneration) {
        this.id = id;
        this.program = program;
        this.birthGeneration = birthGeneration;
    }
    
    // ========== Getters ==========
    
    public long getId() {
        return id;
    }
    
    public Program getProgram() {
        return program;
    }
    
    public int getBirthGeneration() {
        return birthGeneration;
    }
    
    public boolean isEvaluated() {
        return evaluation != null;
    }
    
    public @Nullable Evaluation getEvaluation() {
        return evaluation;
    }
    
    /**
     * @throws IllegalStateException if not evaluated yet
     */
    public double getFitness() {
        Evaluation e = evaluation;
        if (e == null) {
            throw new IllegalStateException("Individual #" + id + " has not been evaluated");
        }
        return e.fitness();
    }
    
    /**
     * Store the evaluation. Each individual is scored once.
     */
    void setEvaluation(@NotNull Evaluation evaluation) {
        if (this.evaluation != null) {
            throw new IllegalStateException("Individual #" + id + " already evaluated");
        }
        this.evaluation = evaluation;
    }
    
    // ========== Object methods ==========
    
    @Override
    public String toString() {
        return String.format("Individual#%d[gen=%d, len=%d, fitness=%s]",
                id, birthGeneration, program.length(),
                evaluation != null ? String.format("%.4f", evaluation.fitness()) : "?");
    }
}
