package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.core.GameRng;

import java.util.List;

/**
 * Parent selection strategy.
 */
public interface Selection {
    
    /**
     * Pick one parent.
     * 
     * @param candidates evaluated individuals, non-empty
     * @param rng random stream of the offspring slot being filled
     */
    Individual select(List<Individual> candidates, GameRng rng);
}
