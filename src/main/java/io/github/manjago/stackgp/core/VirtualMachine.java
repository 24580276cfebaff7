package io.github.manjago.stackgp.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack-machine interpreter for ISA v1.0
 * 
 * Deterministic and step-bounded: the same program on the same initial state
 * always yields the same outcome and step count. Holds no per-run state, so one
 * instance may serve any number of concurrent runs.
 * 
 * Arithmetic is 32-bit two's complement and wraps on overflow.
 */
public final class VirtualMachine {
    
    private static final Logger log = LoggerFactory.getLogger(VirtualMachine.class);
    
    /** Default step limit per run */
    public static final int DEFAULT_STEP_LIMIT = 1000;
    
    /** Maximum number of instructions a single run may execute */
    private final long stepLimit;
    
    /**
     * Create VirtualMachine with default step limit.
     */
    public VirtualMachine() {
        this(DEFAULT_STEP_LIMIT);
    }
    
    /**
     * Create VirtualMachine with custom step limit.
     */
    public VirtualMachine(long stepLimit) {
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("Step limit must be positive: " + stepLimit);
        }
        this.stepLimit = stepLimit;
    }
    
    /**
     * Run a program to completion, fault or timeout.
     * 
     * @param program program to execute
     * @param state initial state; mutated in place and returned in the outcome
     * @return terminal outcome
     */
    public ExecutionOutcome run(Program program, MachineState state) {
        while (true) {
            int ip = state.getIp();
            if (ip == program.length()) {
                // Fell off the end: implicit HALT
                return ExecutionOutcome.completed(state);
            }
            if (state.getSteps() >= stepLimit) {
                return ExecutionOutcome.timedOut(state);
            }
            
            StepResult result = step(program, state);
            
            if (result == StepResult.HALT) {
                return ExecutionOutcome.completed(state);
            }
            if (result.isFault()) {
                if (log.isTraceEnabled()) {
                    log.trace("Fault {} at ip={} after {} steps", result, ip, state.getSteps());
                }
                return ExecutionOutcome.faulted(result.fault(), state);
            }
        }
    }
    
    /**
     * Run a program against a fresh state seeded with the given stack.
     */
    public ExecutionOutcome run(Program program, int... initialStack) {
        return run(program, new MachineState(program.variableSlots(), initialStack, new int[0]));
    }
    
    /**
     * Execute a single instruction.
     * 
     * @param program program being executed
     * @param state machine state of the run
     * @return execution result
     */
    public StepResult step(Program program, MachineState state) {
        int ip = state.getIp();
        
        // Bounds check for IP
        if (ip < 0 || ip >= program.length()) {
            return StepResult.INVALID_JUMP_TARGET;
        }
        
        Instruction ins = program.get(ip);
        state.incrementSteps();
        
        return executeOp(ins.op(), ins.operand(), program, state);
    }
    
    private StepResult executeOp(OpCode op, int operand, Program program, MachineState state) {
        switch (op) {
            case PUSH -> {
                state.push(operand);
                state.advanceIp();
                return StepResult.OK;
            }
            
            case POP -> {
                if (state.depth() < 1) {
                    return StepResult.STACK_UNDERFLOW;
                }
                state.pop();
                state.advanceIp();
                return StepResult.OK;
            }
            
            case DUP -> {
                if (state.depth() < 1) {
                    return StepResult.STACK_UNDERFLOW;
                }
                state.push(state.peek());
                state.advanceIp();
                return StepResult.OK;
            }
            
            case SWAP -> {
                if (state.depth() < 2) {
                    return StepResult.STACK_UNDERFLOW;
                }
                int b = state.pop();
                int a = state.pop();
                state.push(b);
                state.push(a);
                state.advanceIp();
                return StepResult.OK;
            }
            
            case ADD, SUB, MUL, DIV -> {
                return executeArithmetic(op, state);
            }
            
            case LOAD -> {
                if (operand < 0 || operand >= state.variableSlots()) {
                    throw new IllegalStateException("LOAD slot " + operand + " escaped program validation");
                }
                state.push(state.getVariable(operand));
                state.advanceIp();
                return StepResult.OK;
            }
            
            case STORE -> {
                if (operand < 0 || operand >= state.variableSlots()) {
                    throw new IllegalStateException("STORE slot " + operand + " escaped program validation");
                }
                if (state.depth() < 1) {
                    return StepResult.STACK_UNDERFLOW;
                }
                state.setVariable(operand, state.pop());
                state.advanceIp();
                return StepResult.OK;
            }
            
            case JMP -> {
                return jump(operand, program, state);
            }
            
            case JZ -> {
                if (state.depth() < 1) {
                    return StepResult.STACK_UNDERFLOW;
                }
                if (state.pop() == 0) {
                    return jump(operand, program, state);
                }
                state.advanceIp();
                return StepResult.OK;
            }
            
            case HALT -> {
                return StepResult.HALT;
            }
            
            default -> throw new IllegalStateException("Unhandled opcode: " + op);
        }
    }
    
    /**
     * ADD, SUB, MUL, DIV - pop b, pop a, push (a op b).
     */
    private StepResult executeArithmetic(OpCode op, MachineState state) {
        if (state.depth() < 2) {
            return StepResult.STACK_UNDERFLOW;
        }
        int b = state.pop();
        int a = state.pop();
        
        int result;
        switch (op) {
            case ADD -> result = a + b;
            case SUB -> result = a - b;
            case MUL -> result = a * b;
            case DIV -> {
                if (b == 0) {
                    // Leave operands in place so the faulted state shows them
                    state.push(a);
                    state.push(b);
                    return StepResult.DIVISION_BY_ZERO;
                }
                // Java truncates toward zero; MIN_VALUE / -1 wraps to MIN_VALUE
                result = a / b;
            }
            default -> throw new IllegalStateException("Not arithmetic: " + op);
        }
        
        state.push(result);
        state.advanceIp();
        return StepResult.OK;
    }
    
    private StepResult jump(int target, Program program, MachineState state) {
        if (target < 0 || target >= program.length()) {
            return StepResult.INVALID_JUMP_TARGET;
        }
        state.setIp(target);
        return StepResult.OK;
    }
    
    // ========== Getters ==========
    
    public long getStepLimit() {
        return stepLimit;
    }
}
