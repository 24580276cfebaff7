package io.github.manjago.stackgp.problems;

import io.github.manjago.stackgp.fitness.FitnessAggregator;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.fitness.TestCase;

import java.util.List;

/**
 * Problem defined by a fixed table of test cases.
 */
public record TableProblem(
    String name,
    String description,
    List<TestCase> testCases,
    FitnessAggregator aggregator
) implements Problem {

    public TableProblem {
        testCases = List.copyOf(testCases);
    }

    public TableProblem(String name, String description, List<TestCase> testCases) {
        this(name, description, testCases, FitnessAggregator.MEAN);
    }
}
