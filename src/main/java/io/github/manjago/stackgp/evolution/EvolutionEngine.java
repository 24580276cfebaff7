package io.github.manjago.stackgp.evolution;

import io.github.manjago.stackgp.config.ConfigurationException;
import io.github.manjago.stackgp.config.EvolutionConfig;
import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.core.VirtualMachine;
import io.github.manjago.stackgp.fitness.Evaluation;
import io.github.manjago.stackgp.fitness.FitnessEvaluator;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.genetic.Crossover;
import io.github.manjago.stackgp.genetic.InstructionSampler;
import io.github.manjago.stackgp.genetic.Mutator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generational evolution engine.
 * 
 * Owns the population of one run and drives it through
 * SEEDING, then EVALUATING, SELECTING, REPRODUCING, REPLACING per generation
 * until a termination condition fires. Generations are strictly sequential;
 * only fitness evaluation inside a generation may run on several threads.
 * 
 * Every random draw comes from a stream derived from (seed, generation, slot),
 * so a run is fully reproducible from its configuration regardless of thread count.
 */
public class EvolutionEngine implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);
    
    private final EvolutionConfig config;
    private final Problem problem;
    private final long seed;
    
    // Core components
    private final FitnessEvaluator evaluator;
    private final InstructionSampler sampler;
    private final Mutator mutator;
    private final Crossover crossover;
    private final Selection selection;
    private final ExecutorService executor;  // null = evaluate on the calling thread
    
    // Run state
    private Population population;
    private volatile GenerationPhase phase;
    private Individual best;
    private int bestGeneration = -1;
    private int lastImprovementGeneration = -1;
    private final List<GenerationStats> history = new ArrayList<>();
    private long nextId = 0;
    
    // Statistics
    private long totalEvaluations = 0;
    private int crossovers = 0;
    private int declinedCrossovers = 0;
    private int mutations = 0;
    
    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    
    // Event listener
    private EvolutionListener listener = EvolutionListener.NOOP;
    
    /**
     * @throws ConfigurationException if the problem has no test cases or presets more
     *                                variables than the programs have slots
     */
    public EvolutionEngine(EvolutionConfig config, Problem problem) {
        if (problem.testCases().isEmpty()) {
            throw new ConfigurationException(List.of("problem '" + problem.name() + "' has no test cases"));
        }
        List<String> tooWide = new ArrayList<>();
        for (int i = 0; i < problem.testCases().size(); i++) {
            int presets = problem.testCases().get(i).variables().length;
            if (presets > config.variableSlots()) {
                tooWide.add("problem '" + problem.name() + "' test case " + i + " presets " + presets
                        + " variables but program.variable-slots is " + config.variableSlots());
            }
        }
        if (!tooWide.isEmpty()) {
            throw new ConfigurationException(tooWide);
        }
        this.config = config;
        this.problem = problem;
        this.seed = config.effectiveSeed();
        
        VirtualMachine vm = new VirtualMachine(config.stepLimit());
        this.evaluator = new FitnessEvaluator(vm, config.scoring(), config.parsimonyPenalty());
        this.sampler = new InstructionSampler(config.programShape());
        this.mutator = new Mutator(sampler);
        this.crossover = new Crossover(config.programShape());
        this.selection = config.selectionStrategy().create(config.tournamentSize());
        
        int threads = config.effectiveThreads();
        this.executor = threads > 1 ? Executors.newFixedThreadPool(threads, workerFactory()) : null;
        
        log.info("Engine created for problem '{}' (seed: {}, threads: {})", problem.name(), seed, threads);
    }
    
    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "stackgp-eval-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
    
    /**
     * Set event listener for evolution events.
     */
    public void setListener(EvolutionListener listener) {
        this.listener = listener != null ? listener : EvolutionListener.NOOP;
    }
    
    /**
     * Effective random seed (useful for reproducing runs).
     */
    public long getSeed() {
        return seed;
    }
    
    // ========== Run loop ==========
    
    /**
     * Run until solved, exhausted, stagnated or stopped.
     * 
     * @return result of the run
     * @throws IllegalStateException if the engine is already running or was run before
     */
    public EvolutionResult run() {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Engine already running");
        }
        if (population != null) {
            running.set(false);
            throw new IllegalStateException("Engine instances run once; create a new one");
        }
        
        log.info("Starting evolution: population {}, max {} generations",
                config.populationSize(), config.maxGenerations());
        long startTime = System.currentTimeMillis();
        
        try {
            enter(GenerationPhase.SEEDING, 0);
            population = seedPopulation();
            
            TerminationReason reason;
            while (true) {
                int generation = population.generation();
                
                enter(GenerationPhase.EVALUATING, generation);
                if (!evaluate(population)) {
                    reason = TerminationReason.CANCELLED;
                    break;
                }
                
                GenerationStats stats = recordGeneration(population);
                
                reason = checkTermination(stats);
                if (reason == null && stopRequested.get()) {
                    reason = TerminationReason.CANCELLED;
                }
                if (reason != null) {
                    break;
                }
                
                enter(GenerationPhase.SELECTING, generation);
                List<Mating> matings = selectParents(population);
                
                enter(GenerationPhase.REPRODUCING, generation);
                List<Individual> offspring = reproduce(population, matings);
                
                enter(GenerationPhase.REPLACING, generation);
                population = replace(population, offspring);
            }
            
            enter(GenerationPhase.TERMINATED, population.generation());
            EvolutionResult result = buildResult(reason);
            
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Evolution finished: {} after {} generations ({} ms), best fitness {} found in generation {}",
                    reason, history.size(), elapsed,
                    best != null ? String.format("%.4f", best.getFitness()) : "n/a", bestGeneration);
            listener.onTermination(result);
            return result;
        } finally {
            running.set(false);
        }
    }
    
    /**
     * Request graceful stop. Takes effect between evaluations or generations.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }
    
    /**
     * Check if evolution is running.
     */
    public boolean isRunning() {
        return running.get();
    }
    
    private void enter(GenerationPhase next, int generation) {
        phase = next;
        listener.onPhase(next, generation);
    }
    
    // ========== Phases ==========
    
    private Population seedPopulation() {
        List<Individual> individuals = new ArrayList<>(config.populationSize());
        for (int slot = 0; slot < config.populationSize(); slot++) {
            GameRng rng = GameRng.derive(seed, 0, slot);
            individuals.add(newIndividual(sampler.randomProgram(rng), 0));
        }
        log.debug("Seeded {} individuals", individuals.size());
        return new Population(0, individuals);
    }
    
    /**
     * Score every individual without an evaluation.
     * 
     * @return false if the run was cancelled mid-evaluation
     */
    private boolean evaluate(Population pop) {
        List<Individual> pending = pop.unevaluated();
        
        if (executor == null) {
            for (Individual ind : pending) {
                if (stopRequested.get()) {
                    return false;
                }
                ind.setEvaluation(evaluator.evaluate(ind.getProgram(), problem));
            }
            totalEvaluations += pending.size();
            return true;
        }
        
        List<Future<Evaluation>> futures = new ArrayList<>(pending.size());
        for (Individual ind : pending) {
            futures.add(executor.submit(() -> stopRequested.get()
                    ? null
                    : evaluator.evaluate(ind.getProgram(), problem)));
        }
        
        try {
            for (int i = 0; i < pending.size(); i++) {
                Evaluation evaluation = futures.get(i).get();
                if (evaluation == null) {
                    cancelAll(futures);
                    return false;
                }
                pending.get(i).setEvaluation(evaluation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            stopRequested.set(true);
            return false;
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Evaluation failed", cause);
        }
        totalEvaluations += pending.size();
        return true;
    }
    
    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }
    
    /**
     * Parent pair for the offspring slots {@code slot} and {@code slot + 1}.
     */
    private record Mating(int slot, GameRng rng, Individual first, Individual second) {}
    
    private List<Mating> selectParents(Population pop) {
        int nextGeneration = pop.generation() + 1;
        List<Individual> candidates = pop.individuals();
        List<Mating> matings = new ArrayList<>();
        int firstBred = config.elitism() + config.immigrantCount();
        for (int slot = firstBred; slot < config.populationSize(); slot += 2) {
            GameRng rng = GameRng.derive(seed, nextGeneration, slot);
            Individual a = selection.select(candidates, rng);
            Individual b = selection.select(candidates, rng);
            matings.add(new Mating(slot, rng, a, b));
        }
        return matings;
    }
    
    private List<Individual> reproduce(Population pop, List<Mating> matings) {
        int nextGeneration = pop.generation() + 1;
        List<Individual> next = new ArrayList<>(config.populationSize());
        
        // Elites carry over unchanged, evaluation included
        List<Individual> ranked = pop.ranked();
        for (int i = 0; i < config.elitism(); i++) {
            next.add(ranked.get(i));
        }
        
        // Random immigrants take the slots after the elites
        int immigrantEnd = config.elitism() + config.immigrantCount();
        for (int slot = config.elitism(); slot < immigrantEnd; slot++) {
            Program fresh = sampler.randomProgram(GameRng.derive(seed, nextGeneration, slot));
            next.add(newIndividual(fresh, nextGeneration));
        }
        if (immigrantEnd > config.elitism()) {
            log.debug("Generation {}: {} random immigrants", nextGeneration, immigrantEnd - config.elitism());
        }
        
        for (Mating m : matings) {
            Program childA = m.first().getProgram();
            Program childB = m.second().getProgram();
            
            if (m.rng().nextBoolean(config.crossoverRate())) {
                Crossover.Offspring offspring = crossover.crossover(childA, childB, m.rng());
                if (offspring.recombined()) {
                    crossovers++;
                } else {
                    declinedCrossovers++;
                }
                childA = offspring.first();
                childB = offspring.second();
            }
            
            if (m.rng().nextBoolean(config.mutationRate())) {
                childA = mutator.mutate(childA, m.rng());
                mutations++;
            }
            next.add(newIndividual(childA, nextGeneration));
            
            if (m.slot() + 1 < config.populationSize()) {
                if (m.rng().nextBoolean(config.mutationRate())) {
                    childB = mutator.mutate(childB, m.rng());
                    mutations++;
                }
                next.add(newIndividual(childB, nextGeneration));
            }
        }
        return next;
    }
    
    private Population replace(Population current, List<Individual> offspring) {
        if (offspring.size() != config.populationSize()) {
            throw new IllegalStateException("Population size drifted: expected "
                    + config.populationSize() + ", got " + offspring.size());
        }
        return new Population(current.generation() + 1, offspring);
    }
    
    private Individual newIndividual(Program program, int generation) {
        return new Individual(nextId++, program, generation);
    }
    
    // ========== Bookkeeping ==========
    
    private GenerationStats recordGeneration(Population pop) {
        int generation = pop.generation();
        Individual genBest = pop.best();
        
        if (best == null || genBest.getFitness() > best.getFitness()) {
            best = genBest;
            bestGeneration = generation;
            lastImprovementGeneration = generation;
            log.debug("New best in generation {}: {}", generation, genBest);
            listener.onImprovement(genBest, generation);
        }
        
        GenerationStats stats = computeStats(pop, genBest);
        history.add(stats);
        listener.onGeneration(stats, pop);
        
        if (generation % config.reportInterval() == 0) {
            reportProgress(stats);
        }
        return stats;
    }
    
    private GenerationStats computeStats(Population pop, Individual genBest) {
        double sum = 0;
        double worst = Double.POSITIVE_INFINITY;
        long lengthSum = 0;
        int faulting = 0;
        int timingOut = 0;
        int evaluatedNow = 0;
        
        for (Individual ind : pop.individuals()) {
            Evaluation e = ind.getEvaluation();
            sum += e.fitness();
            worst = Math.min(worst, e.fitness());
            lengthSum += ind.getProgram().length();
            if (e.faultedAny()) faulting++;
            if (e.timedOutAny()) timingOut++;
            if (ind.getBirthGeneration() == pop.generation()) evaluatedNow++;
        }
        
        int size = pop.size();
        Evaluation bestEval = genBest.getEvaluation();
        return new GenerationStats(
            pop.generation(),
            bestEval.fitness(),
            sum / size,
            worst,
            (double) lengthSum / size,
            bestEval.exactCases(),
            bestEval.totalCases(),
            faulting,
            timingOut,
            size,
            evaluatedNow
        );
    }
    
    private void reportProgress(GenerationStats stats) {
        log.info("Generation {}: best {} ({}/{} exact), mean {}, faulting {}%",
                stats.generation(),
                String.format("%.4f", stats.bestFitness()),
                stats.bestExactCases(), stats.totalCases(),
                String.format("%.4f", stats.meanFitness()),
                String.format("%.1f", stats.faultFraction() * 100));
        listener.onProgress(stats);
    }
    
    /**
     * @return reason to stop after this generation, or null to continue
     */
    private @Nullable TerminationReason checkTermination(GenerationStats stats) {
        int generation = stats.generation();
        if (best.getFitness() >= config.fitnessThreshold()) {
            return TerminationReason.SOLVED;
        }
        if (config.stagnationWindow() > 0
                && generation - lastImprovementGeneration >= config.stagnationWindow()) {
            return TerminationReason.STAGNATED;
        }
        if (generation + 1 >= config.maxGenerations()) {
            return TerminationReason.EXHAUSTED;
        }
        return null;
    }
    
    private EvolutionResult buildResult(TerminationReason reason) {
        if (best == null) {
            return new EvolutionResult(null, Double.NaN, null, -1, history.size(), reason, seed, history);
        }
        return new EvolutionResult(
            best.getProgram(),
            best.getFitness(),
            best.getEvaluation(),
            bestGeneration,
            history.size(),
            reason,
            seed,
            history
        );
    }
    
    // ========== Getters ==========
    
    public EvolutionConfig getConfig() { return config; }
    public Problem getProblem() { return problem; }
    public GenerationPhase getPhase() { return phase; }
    public @Nullable Population getPopulation() { return population; }
    public List<GenerationStats> getHistory() { return List.copyOf(history); }
    public long getTotalEvaluations() { return totalEvaluations; }
    public int getCrossovers() { return crossovers; }
    public int getDeclinedCrossovers() { return declinedCrossovers; }
    public int getMutations() { return mutations; }
    
    /**
     * Shut down the evaluation workers.
     */
    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
