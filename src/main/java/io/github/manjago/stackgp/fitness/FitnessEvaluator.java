package io.github.manjago.stackgp.fitness;

import io.github.manjago.stackgp.core.ExecutionOutcome;
import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.core.VirtualMachine;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Scores programs by running them on a problem's test cases.
 * <p>
 * Every case runs on a fresh {@link io.github.manjago.stackgp.core.MachineState}.
 * Completed runs are scored with the configured {@link CaseScoring}; faults,
 * timeouts and runs that leave an empty stack get {@link CaseScoring#FAULT_SCORE}.
 * The case scores are aggregated by the problem. Programs that complete every
 * case then pay a parsimony penalty proportional to their length. The penalty
 * is capped at half the distance to the best aggregate a program with a failed
 * case could reach, so it never ranks a clean program below a failing one.
 * Aggregators are assumed monotone in every case score.
 * <p>
 * Programs are assumed to be structurally valid. The evaluator keeps no state
 * between calls and is safe to share across threads.
 */
public final class FitnessEvaluator {

    private final VirtualMachine vm;
    private final CaseScoring scoring;
    private final double parsimonyPenalty;

    public FitnessEvaluator(VirtualMachine vm) {
        this(vm, CaseScoring.DISTANCE, 0.0);
    }

    /**
     * @param vm machine used for every run
     * @param scoring per-case scoring of completed runs
     * @param parsimonyPenalty fitness subtracted per instruction from programs that complete every case
     */
    public FitnessEvaluator(VirtualMachine vm, CaseScoring scoring, double parsimonyPenalty) {
        if (parsimonyPenalty < 0) {
            throw new IllegalArgumentException("Parsimony penalty must be >= 0: " + parsimonyPenalty);
        }
        this.vm = vm;
        this.scoring = scoring;
        this.parsimonyPenalty = parsimonyPenalty;
    }

    /**
     * Evaluate a program against all test cases of a problem.
     */
    public Evaluation evaluate(Program program, Problem problem) {
        List<TestCase> cases = problem.testCases();
        double[] scores = new double[cases.size()];
        int exact = 0;
        int faulted = 0;
        int timedOut = 0;
        int empty = 0;
        long steps = 0;

        for (int i = 0; i < cases.size(); i++) {
            TestCase tc = cases.get(i);
            ExecutionOutcome outcome = vm.run(program, tc.newState(program.variableSlots()));
            steps += outcome.steps();

            switch (outcome.status()) {
                case FAULTED -> {
                    faulted++;
                    scores[i] = CaseScoring.FAULT_SCORE;
                }
                case TIMED_OUT -> {
                    timedOut++;
                    scores[i] = CaseScoring.FAULT_SCORE;
                }
                case COMPLETED -> {
                    OptionalInt top = outcome.topOfStack();
                    if (top.isEmpty()) {
                        empty++;
                        scores[i] = CaseScoring.FAULT_SCORE;
                    } else {
                        if (top.getAsInt() == tc.expected()) {
                            exact++;
                        }
                        scores[i] = scoring.score(top.getAsInt(), tc.expected());
                    }
                }
            }
        }

        double raw = problem.aggregator().aggregate(scores);
        double fitness = raw;
        if (parsimonyPenalty > 0 && faulted + timedOut + empty == 0) {
            double headroom = raw - failingCeiling(problem.aggregator(), cases.size());
            if (headroom > 0) {
                fitness -= Math.min(parsimonyPenalty * program.length(), headroom / 2);
            }
        }
        fitness = Math.max(0.0, fitness);
        return new Evaluation(fitness, exact, faulted, timedOut, empty, cases.size(), steps);
    }

    /**
     * Best aggregate a program can reach while failing one case: every other case exact.
     */
    private static double failingCeiling(FitnessAggregator aggregator, int caseCount) {
        double[] scores = new double[caseCount];
        Arrays.fill(scores, CaseScoring.MAX_SCORE);
        if (caseCount > 0) {
            scores[0] = CaseScoring.FAULT_SCORE;
        }
        return aggregator.aggregate(scores);
    }

    /**
     * Evaluate and return only the fitness.
     */
    public double fitness(Program program, Problem problem) {
        return evaluate(program, problem).fitness();
    }

    public VirtualMachine getVm() {
        return vm;
    }

    public CaseScoring getScoring() {
        return scoring;
    }

    public double getParsimonyPenalty() {
        return parsimonyPenalty;
    }
}
