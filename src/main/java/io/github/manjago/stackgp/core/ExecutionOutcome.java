package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Terminal outcome of running a program.
 *
 * @param status how the run ended
 * @param fault fault reason when {@code status == FAULTED}, otherwise null
 * @param finalState machine state at the end of the run
 * @param steps instructions executed
 */
public record ExecutionOutcome(
    @NotNull Status status,
    @Nullable Fault fault,
    @NotNull MachineState finalState,
    long steps
) {
    
    public enum Status {
        /** HALT executed or IP ran past the last instruction */
        COMPLETED,
        
        /** Step limit reached */
        TIMED_OUT,
        
        /** Runtime fault */
        FAULTED
    }
    
    public static ExecutionOutcome completed(MachineState state) {
        return new ExecutionOutcome(Status.COMPLETED, null, state, state.getSteps());
    }
    
    public static ExecutionOutcome timedOut(MachineState state) {
        return new ExecutionOutcome(Status.TIMED_OUT, null, state, state.getSteps());
    }
    
    public static ExecutionOutcome faulted(Fault fault, MachineState state) {
        return new ExecutionOutcome(Status.FAULTED, fault, state, state.getSteps());
    }
    
    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
    
    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }
    
    public boolean isFaulted() {
        return status == Status.FAULTED;
    }
    
    /**
     * @return top of stack for a completed run with a non-empty stack
     */
    public OptionalInt topOfStack() {
        if (!isCompleted() || finalState.isStackEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(finalState.peek());
    }
    
    @Override
    public String toString() {
        return switch (status) {
            case COMPLETED -> "Completed[steps=" + steps + ", stack=" 
                    + Arrays.toString(finalState.stackSnapshot()) + "]";
            case TIMED_OUT -> "TimedOut[steps=" + steps + "]";
            case FAULTED -> "Faulted(" + fault + ")[steps=" + steps + ", ip=" + finalState.getIp() + "]";
        };
    }
}
