package io.github.manjago.stackgp.problems;

import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.fitness.TestCase;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;

/**
 * Built-in problems, looked up by name from the command line.
 */
public final class Problems {

    private static final Map<String, Problem> BUILT_IN = new LinkedHashMap<>();

    static {
        register(binary("addition", "a b -> a + b", 0, 9, (a, b) -> a + b));
        register(binary("multiplication", "a b -> a * b", 0, 9, (a, b) -> a * b));
        register(binary("difference", "a b -> |a - b|", 0, 9, (a, b) -> Math.abs(a - b)));
        register(unary("square", "x -> x * x", -5, 5, x -> x * x));
        register(unary("cube-plus-one", "x -> x^3 + 1", -4, 4, x -> x * x * x + 1));
    }

    private Problems() {
        // Utility class
    }

    private static void register(Problem problem) {
        BUILT_IN.put(problem.name(), problem);
    }

    /**
     * @return problem with that name (case-insensitive), or null
     */
    public static @Nullable Problem byName(String name) {
        return BUILT_IN.get(name.toLowerCase(Locale.ROOT));
    }

    public static List<Problem> all() {
        return List.copyOf(BUILT_IN.values());
    }

    public static List<String> names() {
        return List.copyOf(BUILT_IN.keySet());
    }

    /**
     * Every pair (a, b) in [from, to] squared, stack {@code [a, b]}.
     */
    public static Problem binary(String name, String description, int from, int to, IntBinaryOperator target) {
        List<TestCase> cases = new ArrayList<>();
        for (int a = from; a <= to; a++) {
            for (int b = from; b <= to; b++) {
                cases.add(TestCase.of(target.applyAsInt(a, b), a, b));
            }
        }
        return new TableProblem(name, description, cases);
    }

    /**
     * Every x in [from, to], stack {@code [x]}.
     */
    public static Problem unary(String name, String description, int from, int to, IntUnaryOperator target) {
        List<TestCase> cases = new ArrayList<>();
        for (int x = from; x <= to; x++) {
            cases.add(TestCase.of(target.applyAsInt(x), x));
        }
        return new TableProblem(name, description, cases);
    }
}
