package io.github.manjago.stackgp.fitness;

/**
 * Reduces per-case scores to a single fitness value.
 */
@FunctionalInterface
public interface FitnessAggregator {

    /**
     * @param caseScores one score per test case, each in [0, 1]
     * @return aggregate fitness, higher is better
     */
    double aggregate(double[] caseScores);

    /** Arithmetic mean; fitness stays in [0, 1]. */
    FitnessAggregator MEAN = scores -> {
        if (scores.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double s : scores) {
            sum += s;
        }
        return sum / scores.length;
    };

    /** Plain sum. */
    FitnessAggregator SUM = scores -> {
        double sum = 0;
        for (double s : scores) {
            sum += s;
        }
        return sum;
    };
}
