package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.core.GameRng;

import java.util.List;

/**
 * Fitness-proportionate selection. Requires non-negative fitness; falls back
 * to a uniform pick when every candidate has zero fitness.
 */
public final class RouletteSelection implements Selection {
    
    @Override
    public Individual select(List<Individual> candidates, GameRng rng) {
        double total = 0;
        for (Individual ind : candidates) {
            double f = ind.getFitness();
            if (f < 0) {
                throw new IllegalStateException("Roulette selection needs non-negative fitness, got "
                        + f + " for " + ind);
            }
            total += f;
        }
        
        if (total <= 0) {
            return candidates.get(rng.nextInt(candidates.size()));
        }
        
        double spin = rng.nextDouble() * total;
        for (Individual ind : candidates) {
            spin -= ind.getFitness();
            if (spin < 0) {
                return ind;
            }
        }
        // Rounding left a sliver at the end of the wheel
        return candidates.get(candidates.size() - 1);
    }
}
