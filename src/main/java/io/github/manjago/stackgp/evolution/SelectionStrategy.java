package io.github.manjago.stackgp.evolution;

/**
 * Configurable selection strategies.
 */
public enum SelectionStrategy {
    
    /** Best of k random draws (default) */
    TOURNAMENT,
    
    /** Fitness-proportionate */
    ROULETTE;
    
    public Selection create(int tournamentSize) {
        return switch (this) {
            case TOURNAMENT -> new TournamentSelection(tournamentSize);
            case ROULETTE -> new RouletteSelection();
        };
    }
}
