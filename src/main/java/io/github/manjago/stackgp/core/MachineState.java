package io.github.manjago.stackgp.core;

import java.util.Arrays;

/**
 * Machine state for a single program run.
 * 
 * Contains:
 * - Value stack (grows and shrinks only through executed instructions)
 * - Fixed-size variable bank
 * - Instruction pointer (absolute index into the program)
 * - Step counter (instructions executed so far)
 * 
 * A state is created fresh for every run and owned by that run alone.
 */
public final class MachineState {
    
    private static final int INITIAL_CAPACITY = 16;
    
    /** Value stack, bottom at index 0 */
    private int[] stack;
    
    /** Number of values on the stack */
    private int depth;
    
    /** Variable bank */
    private final int[] variables;
    
    /** Instruction pointer */
    private int ip;
    
    /** Instructions executed */
    private long steps;
    
    /**
     * Empty stack, zeroed variable bank of the given size.
     */
    public MachineState(int variableSlots) {
        this.stack = new int[INITIAL_CAPACITY];
        this.depth = 0;
        this.variables = new int[variableSlots];
        this.ip = 0;
        this.steps = 0;
    }
    
    /**
     * State seeded with initial stack values (bottom first) and variable presets.
     * 
     * @param variableSlots variable bank size
     * @param initialStack values to push, bottom first
     * @param initialVariables values for the first slots; may be shorter than the bank
     */
    public MachineState(int variableSlots, int[] initialStack, int[] initialVariables) {
        this(variableSlots);
        if (initialVariables.length > variableSlots) {
            throw new IllegalArgumentException("Variable preset has " + initialVariables.length
                    + " values but the bank has " + variableSlots + " slots");
        }
        for (int value : initialStack) {
            push(value);
        }
        System.arraycopy(initialVariables, 0, variables, 0, initialVariables.length);
    }
    
    /**
     * Copy constructor - creates independent copy of state.
     */
    public MachineState(MachineState other) {
        this.stack = other.stack.clone();
        this.depth = other.depth;
        this.variables = other.variables.clone();
        this.ip = other.ip;
        this.steps = other.steps;
    }
    
    // ========== Stack ==========
    
    public void push(int value) {
        if (depth == stack.length) {
            stack = Arrays.copyOf(stack, stack.length * 2);
        }
        stack[depth++] = value;
    }
    
    /**
     * Pop top value. Callers check {@link #depth()} first.
     */
    public int pop() {
        if (depth == 0) {
            throw new IllegalStateException("pop on empty stack");
        }
        return stack[--depth];
    }
    
    public int peek() {
        if (depth == 0) {
            throw new IllegalStateException("peek on empty stack");
        }
        return stack[depth - 1];
    }
    
    public int depth() {
        return depth;
    }
    
    public boolean isStackEmpty() {
        return depth == 0;
    }
    
    /**
     * @return copy of the stack, bottom first
     */
    public int[] stackSnapshot() {
        return Arrays.copyOf(stack, depth);
    }
    
    // ========== Variables ==========
    
    public int getVariable(int slot) {
        return variables[slot];
    }
    
    public void setVariable(int slot, int value) {
        variables[slot] = value;
    }
    
    public int variableSlots() {
        return variables.length;
    }
    
    public int[] variablesSnapshot() {
        return variables.clone();
    }
    
    // ========== IP ==========
    
    public int getIp() {
        return ip;
    }
    
    public void setIp(int ip) {
        this.ip = ip;
    }
    
    /**
     * Advance IP by 1 (after executing instruction).
     */
    public void advanceIp() {
        this.ip++;
    }
    
    // ========== Steps ==========
    
    public long getSteps() {
        return steps;
    }
    
    public void incrementSteps() {
        this.steps++;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("MachineState{IP=").append(ip);
        sb.append(", steps=").append(steps);
        sb.append(", stack=").append(Arrays.toString(stackSnapshot()));
        sb.append(", vars=").append(Arrays.toString(variables));
        sb.append('}');
        return sb.toString();
    }
}
