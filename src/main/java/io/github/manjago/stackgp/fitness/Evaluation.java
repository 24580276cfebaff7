package io.github.manjago.stackgp.fitness;

/**
 * Fitness of one program on one problem, with diagnostic counters.
 *
 * @param fitness aggregated score minus parsimony penalty, never negative
 * @param exactCases cases whose top of stack matched exactly
 * @param faultedCases cases that ended in a runtime fault
 * @param timedOutCases cases that hit the step limit
 * @param emptyCases cases that completed with an empty stack
 * @param totalCases number of cases
 * @param steps instructions executed across all cases
 */
public record Evaluation(
    double fitness,
    int exactCases,
    int faultedCases,
    int timedOutCases,
    int emptyCases,
    int totalCases,
    long steps
) {

    public boolean solvedAllCases() {
        return totalCases > 0 && exactCases == totalCases;
    }

    public boolean faultedAny() {
        return faultedCases > 0;
    }

    public boolean timedOutAny() {
        return timedOutCases > 0;
    }

    @Override
    public String toString() {
        return String.format("Evaluation[fitness=%.4f, exact=%d/%d, faulted=%d, timedOut=%d, empty=%d]",
                fitness, exactCases, totalCases, faultedCases, timedOutCases, emptyCases);
    }
}
