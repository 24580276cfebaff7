package io.github.manjago.stackgp.evolution;

/**
 * Listener for evolution events.
 * 
 * Implement this interface to react to run progress,
 * for example to print a progress line or record populations.
 */
public interface EvolutionListener {
    
    /**
     * Called when the loop enters a new phase.
     * 
     * @param phase phase being entered
     * @param generation generation the phase works on
     */
    default void onPhase(GenerationPhase phase, int generation) {}
    
    /**
     * Called after every generation has been evaluated.
     * 
     * @param stats statistics of the generation
     * @param population the evaluated population
     */
    default void onGeneration(GenerationStats stats, Population population) {}
    
    /**
     * Called when the best fitness of the run improves.
     * 
     * @param best new best individual
     * @param generation generation in which it was found
     */
    default void onImprovement(Individual best, int generation) {}
    
    /**
     * Called at the configured reporting interval.
     * 
     * @param stats statistics of the generation just evaluated
     */
    default void onProgress(GenerationStats stats) {}
    
    /**
     * Called once when the run ends.
     * 
     * @param result final result
     */
    default void onTermination(EvolutionResult result) {}
    
    /**
     * No-op listener that does nothing.
     */
    EvolutionListener NOOP = new EvolutionListener() {};
}
