package io.github.manjago.stackgp.fitness;

import java.util.List;

/**
 * Target behaviour a program should reproduce.
 * <p>
 * Implementations supply the test cases and, optionally, their own aggregation.
 * The evaluator depends only on this contract.
 */
public interface Problem {

    /**
     * Short identifier, e.g. "addition".
     */
    String name();

    /**
     * One-line human description.
     */
    default String description() {
        return name();
    }

    /**
     * Test cases; must not be empty.
     */
    List<TestCase> testCases();

    /**
     * How case scores are combined into fitness.
     */
    default FitnessAggregator aggregator() {
        return FitnessAggregator.MEAN;
    }
}
