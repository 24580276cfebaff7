package io.github.manjago.stackgp.fitness;

import io.github.manjago.stackgp.core.MachineState;

import java.util.Arrays;

/**
 * One input/expected-output pair.
 *
 * @param stack initial stack, bottom first
 * @param variables initial values for the first variable slots
 * @param expected expected top of stack after the run
 */
public record TestCase(int[] stack, int[] variables, int expected) {

    public TestCase {
        stack = stack.clone();
        variables = variables.clone();
    }

    /**
     * Test case with the given stack and no variable presets.
     */
    public static TestCase of(int expected, int... stack) {
        return new TestCase(stack, new int[0], expected);
    }

    /**
     * Fresh machine state seeded from this case.
     */
    public MachineState newState(int variableSlots) {
        return new MachineState(variableSlots, stack, variables);
    }

    @Override
    public int[] stack() {
        return stack.clone();
    }

    @Override
    public int[] variables() {
        return variables.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestCase other)) return false;
        return expected == other.expected
                && Arrays.equals(stack, other.stack)
                && Arrays.equals(variables, other.variables);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(stack) + Arrays.hashCode(variables)) + expected;
    }

    @Override
    public String toString() {
        String vars = variables.length == 0 ? "" : " vars=" + Arrays.toString(variables);
        return Arrays.toString(stack) + vars + " -> " + expected;
    }
}
