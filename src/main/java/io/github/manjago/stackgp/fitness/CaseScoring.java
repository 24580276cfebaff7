package io.github.manjago.stackgp.fitness;

/**
 * Score of a completed run on one test case, in [0, 1].
 * Faulting and timed-out runs always score {@link #FAULT_SCORE}.
 */
public enum CaseScoring {

    /**
     * 1 / (1 + |actual - expected|). Any completing run scores above zero,
     * an exact match scores 1.
     */
    DISTANCE {
        @Override
        public double score(int actual, int expected) {
            long distance = Math.abs((long) actual - (long) expected);
            return 1.0 / (1.0 + distance);
        }
    },

    /**
     * 1 for an exact match, {@link #MISS_SCORE} for any other completed answer.
     * Aggregated by the mean this is the success ratio, nudged so that answering
     * wrongly still beats faulting.
     */
    EXACT {
        @Override
        public double score(int actual, int expected) {
            return actual == expected ? MAX_SCORE : MISS_SCORE;
        }
    };

    /** Score of an exact match */
    public static final double MAX_SCORE = 1.0;

    /** Score of a completed but wrong answer under {@link #EXACT}; above {@link #FAULT_SCORE} */
    public static final double MISS_SCORE = 0.001;

    /** Score of a faulted, timed-out or result-less run */
    public static final double FAULT_SCORE = 0.0;

    public abstract double score(int actual, int expected);
}
