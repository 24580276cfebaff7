package io.github.manjago.stackgp.evolution;

/**
 * Snapshot of one evaluated generation.
 */
public record GenerationStats(
    int generation,
    double bestFitness,
    double meanFitness,
    double worstFitness,
    double meanLength,
    int bestExactCases,
    int totalCases,
    int faultingIndividuals,    // at least one faulted case
    int timingOutIndividuals,   // at least one timed-out case
    int populationSize,
    int evaluations             // individuals scored in this generation
) {
    
    /**
     * Fraction of the population that faulted on some case.
     */
    public double faultFraction() {
        return populationSize > 0 ? (double) faultingIndividuals / populationSize : 0;
    }
    
    /**
     * Fraction of the population that hit the step limit on some case.
     */
    public double timeoutFraction() {
        return populationSize > 0 ? (double) timingOutIndividuals / populationSize : 0;
    }
    
    @Override
    public String toString() {
        return String.format(
            "Gen %d: best=%.4f (%d/%d exact), mean=%.4f, worst=%.4f, len=%.1f, faulting=%.1f%%, timeouts=%.1f%%",
            generation, bestFitness, bestExactCases, totalCases, meanFitness, worstFitness,
            meanLength, faultFraction() * 100, timeoutFraction() * 100);
    }
}
