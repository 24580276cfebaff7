package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.Nullable;

/**
 * Result of executing a single instruction.
 */
public enum StepResult {
    
    /** Instruction executed, execution continues */
    OK(null),
    
    /** HALT executed */
    HALT(null),
    
    /** Not enough values on the stack for the instruction */
    STACK_UNDERFLOW(Fault.STACK_UNDERFLOW),
    
    /** DIV with zero divisor */
    DIVISION_BY_ZERO(Fault.DIVISION_BY_ZERO),
    
    /** IP or jump target outside the program */
    INVALID_JUMP_TARGET(Fault.INVALID_JUMP_TARGET);
    
    private final Fault fault;
    
    StepResult(Fault fault) {
        this.fault = fault;
    }
    
    /**
     * @return true if this result indicates a runtime fault
     */
    public boolean isFault() {
        return fault != null;
    }
    
    /**
     * @return the fault, or null for OK/HALT
     */
    public @Nullable Fault fault() {
        return fault;
    }
}
