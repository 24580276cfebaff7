package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.core.GameRng;

import java.util.List;

/**
 * Draws {@code size} candidates uniformly with replacement and keeps the best.
 * Only the ranking matters, so it works with any fitness scale.
 */
public final class TournamentSelection implements Selection {
    
    private final int size;
    
    public TournamentSelection(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Tournament size must be >= 1: " + size);
        }
        this.size = size;
    }
    
    @Override
    public Individual select(List<Individual> candidates, GameRng rng) {
        Individual best = candidates.get(rng.nextInt(candidates.size()));
        for (int i = 1; i < size; i++) {
            Individual challenger = candidates.get(rng.nextInt(candidates.size()));
            if (Individual.BEST_FIRST.compare(challenger, best) < 0) {
                best = challenger;
            }
        }
        return best;
    }
    
    public int getSize() {
        return size;
    }
}
