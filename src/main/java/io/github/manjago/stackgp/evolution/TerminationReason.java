package io.github.manjago.stackgp.evolution;

/**
 * Why a run ended.
 */
public enum TerminationReason {
    
    /** Best fitness reached the threshold */
    SOLVED,
    
    /** Generation limit reached */
    EXHAUSTED,
    
    /** Best fitness did not improve within the stagnation window */
    STAGNATED,
    
    /** Stop requested from outside */
    CANCELLED
}
