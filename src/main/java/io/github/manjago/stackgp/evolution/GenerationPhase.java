package io.github.manjago.stackgp.evolution;

/**
 * States of the generation loop.
 * SEEDING runs once; the loop then cycles EVALUATING, SELECTING, REPRODUCING,
 * REPLACING until it moves to TERMINATED.
 */
public enum GenerationPhase {
    SEEDING,
    EVALUATING,
    SELECTING,
    REPRODUCING,
    REPLACING,
    TERMINATED
}
