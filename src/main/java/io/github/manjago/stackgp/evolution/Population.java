package io.github.manjago.stackgp.evolution;

import java.util.ArrayList;
import java.util.List;

/**
 * One generation of individuals. The list is fixed once built; the engine
 * replaces the whole population each generation.
 */
public final class Population {
    
    private final int generation;
    private final List<Individual> individuals;
    
    public Population(int generation, List<Individual> individuals) {
        this.generation = generation;
        this.individuals = List.copyOf(individuals);
    }
    
    public int generation() {
        return generation;
    }
    
    public int size() {
        return individuals.size();
    }
    
    public Individual get(int index) {
        return individuals.get(index);
    }
    
    public List<Individual> individuals() {
        return individuals;
    }
    
    public boolean isFullyEvaluated() {
        for (Individual ind : individuals) {
            if (!ind.isEvaluated()) {
                return false;
            }
        }
        return true;
    }
    
    public List<Individual> unevaluated() {
        List<Individual> result = new ArrayList<>();
        for (Individual ind : individuals) {
            if (!ind.isEvaluated()) {
                result.add(ind);
            }
        }
        return result;
    }
    
    /**
     * Evaluated individuals, best first.
     */
    public List<Individual> ranked() {
        List<Individual> sorted = new ArrayList<>(individuals.size());
        for (Individual ind : individuals) {
            if (ind.isEvaluated()) {
                sorted.add(ind);
            }
        }
        sorted.sort(Individual.BEST_FIRST);
        return sorted;
    }
    
    /**
     * @throws IllegalStateException if nothing has been evaluated
     */
    public Individual best() {
        Individual best = null;
        for (Individual ind : individuals) {
            if (ind.isEvaluated() && (best == null || Individual.BEST_FIRST.compare(ind, best) < 0)) {
                best = ind;
            }
        }
        if (best == null) {
            throw new IllegalStateException("Generation " + generation + " has no evaluated individuals");
        }
        return best;
    }
    
    @Override
    public String toString() {
        return "Population[gen=" + generation + ", size=" + individuals.size() + "]";
    }
}
