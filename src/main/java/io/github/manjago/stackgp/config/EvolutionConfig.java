package io.github.manjago.stackgp.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import io.github.manjago.stackgp.evolution.SelectionStrategy;
import io.github.manjago.stackgp.fitness.CaseScoring;
import io.github.manjago.stackgp.genetic.ProgramShape;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for one evolutionary run. Immutable and validated on construction.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EvolutionConfig(
    // Population
    int populationSize,
    int elitism,
    double immigrants,        // fraction of each new generation filled with fresh random programs
    
    // Genetic operators
    double mutationRate,      // probability an offspring is mutated once
    double crossoverRate,     // probability a parent pair is recombined
    
    // Program grammar
    int minLength,
    int maxLength,
    int variableSlots,
    int literalMin,
    int literalMax,
    boolean allowJumps,
    
    // Limits
    int maxGenerations,
    long stepLimit,
    int stagnationWindow,     // 0 = disabled
    
    // Selection
    SelectionStrategy selectionStrategy,
    int tournamentSize,
    
    // Fitness
    double fitnessThreshold,
    double parsimonyPenalty,
    CaseScoring scoring,
    
    // Runtime
    long randomSeed,          // 0 = derive from clock
    int evaluationThreads,    // 0 = available processors
    int reportInterval        // generations between progress reports
) {
    
    public EvolutionConfig {
        List<String> problems = validate(populationSize, elitism, immigrants, mutationRate, crossoverRate,
                minLength, maxLength, variableSlots, literalMin, literalMax, maxGenerations,
                stepLimit, stagnationWindow, selectionStrategy, tournamentSize, fitnessThreshold,
                parsimonyPenalty, scoring, evaluationThreads, reportInterval);
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }
    
    private static List<String> validate(int populationSize, int elitism, double immigrants,
                                         double mutationRate, double crossoverRate,
                                         int minLength, int maxLength,
                                         int variableSlots, int literalMin, int literalMax,
                                         int maxGenerations, long stepLimit, int stagnationWindow,
                                         SelectionStrategy selectionStrategy, int tournamentSize,
                                         double fitnessThreshold, double parsimonyPenalty,
                                         CaseScoring scoring, int evaluationThreads, int reportInterval) {
        List<String> problems = new ArrayList<>();
        if (populationSize < 1) {
            problems.add("population.size must be >= 1, got " + populationSize);
        }
        if (elitism < 0 || elitism > populationSize) {
            problems.add("population.elitism must be in [0, population.size], got " + elitism);
        }
        if (!(immigrants >= 0.0 && immigrants <= 1.0)) {
            problems.add("population.immigrants must be in [0, 1], got " + immigrants);
        } else if (elitism >= 0 && elitism <= populationSize
                && elitism + immigrantCount(populationSize, immigrants) > populationSize) {
            problems.add("population.elitism plus immigrants exceed population.size: "
                    + elitism + " + " + immigrantCount(populationSize, immigrants) + " > " + populationSize);
        }
        if (!(mutationRate >= 0.0 && mutationRate <= 1.0)) {
            problems.add("genetic.mutation-rate must be in [0, 1], got " + mutationRate);
        }
        if (!(crossoverRate >= 0.0 && crossoverRate <= 1.0)) {
            problems.add("genetic.crossover-rate must be in [0, 1], got " + crossoverRate);
        }
        if (minLength < 1) {
            problems.add("program.min-length must be >= 1, got " + minLength);
        }
        if (maxLength < minLength) {
            problems.add("program.max-length must be >= program.min-length, got "
                    + maxLength + " < " + minLength);
        }
        if (variableSlots < 0) {
            problems.add("program.variable-slots must be >= 0, got " + variableSlots);
        }
        if (literalMin > literalMax) {
            problems.add("program.literal-min must be <= program.literal-max, got "
                    + literalMin + " > " + literalMax);
        }
        if (maxGenerations < 1) {
            problems.add("limits.max-generations must be >= 1, got " + maxGenerations);
        }
        if (stepLimit < 1) {
            problems.add("limits.step-limit must be >= 1, got " + stepLimit);
        }
        if (stagnationWindow < 0) {
            problems.add("limits.stagnation-window must be >= 0, got " + stagnationWindow);
        }
        if (selectionStrategy == null) {
            problems.add("selection.strategy is required");
        }
        if (tournamentSize < 1) {
            problems.add("selection.tournament-size must be >= 1, got " + tournamentSize);
        }
        if (Double.isNaN(fitnessThreshold) || Double.isInfinite(fitnessThreshold)) {
            problems.add("fitness.threshold must be finite, got " + fitnessThreshold);
        }
        if (!(parsimonyPenalty >= 0.0)) {
            problems.add("fitness.parsimony-penalty must be >= 0, got " + parsimonyPenalty);
        }
        if (scoring == null) {
            problems.add("fitness.scoring is required");
        }
        if (evaluationThreads < 0) {
            problems.add("evaluation.threads must be >= 0, got " + evaluationThreads);
        }
        if (reportInterval < 1) {
            problems.add("reporting.interval must be >= 1, got " + reportInterval);
        }
        return problems;
    }
    
    /**
     * Load default configuration.
     */
    public static EvolutionConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }
    
    /**
     * Load configuration from a specific file, falling back to reference.conf for missing keys.
     * 
     * @throws ConfigurationException if the file is missing or unparseable
     */
    public static EvolutionConfig fromFile(Path configFile) {
        Config fileConfig;
        try {
            fileConfig = ConfigFactory.parseFile(configFile.toFile(),
                    ConfigParseOptions.defaults().setAllowMissing(false));
        } catch (ConfigException e) {
            throw new ConfigurationException("Cannot read " + configFile + ": " + e.getMessage(), e);
        }
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }
    
    /**
     * Load from Config object.
     * 
     * @throws ConfigurationException if a key is missing, mistyped or out of range
     */
    public static EvolutionConfig fromConfig(Config config) {
        try {
            Config c = config.getConfig("stackgp");
            
            return new EvolutionConfig(
                c.getInt("population.size"),
                c.getInt("population.elitism"),
                c.getDouble("population.immigrants"),
                c.getDouble("genetic.mutation-rate"),
                c.getDouble("genetic.crossover-rate"),
                c.getInt("program.min-length"),
                c.getInt("program.max-length"),
                c.getInt("program.variable-slots"),
                c.getInt("program.literal-min"),
                c.getInt("program.literal-max"),
                c.getBoolean("program.allow-jumps"),
                c.getInt("limits.max-generations"),
                c.getLong("limits.step-limit"),
                c.getInt("limits.stagnation-window"),
                parseEnum(SelectionStrategy.class, c, "selection.strategy"),
                c.getInt("selection.tournament-size"),
                c.getDouble("fitness.threshold"),
                c.getDouble("fitness.parsimony-penalty"),
                parseEnum(CaseScoring.class, c, "fitness.scoring"),
                c.getLong("random.seed"),
                c.getInt("evaluation.threads"),
                c.getInt("reporting.interval")
            );
        } catch (ConfigException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }
    
    private static <E extends Enum<E>> E parseEnum(Class<E> type, Config c, String path) {
        String raw = c.getString(path);
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(path, "unknown value '" + raw + "'", e);
        }
    }
    
    // ========== Derived views ==========
    
    /**
     * Random immigrants per generation: the configured fraction of the population, rounded down.
     */
    public int immigrantCount() {
        return immigrantCount(populationSize, immigrants);
    }
    
    private static int immigrantCount(int populationSize, double immigrants) {
        return (int) Math.floor(immigrants * Math.max(populationSize, 0));
    }
    
    /**
     * Grammar constraints handed to the genetic operators.
     */
    public ProgramShape programShape() {
        return new ProgramShape(minLength, maxLength, variableSlots, literalMin, literalMax, allowJumps);
    }
    
    /**
     * Seed to use: the configured one, or a clock-derived one if 0.
     * Callers resolve it once per run and log it.
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime() ^ 0x5DEECE66DL;
    }
    
    /**
     * Worker count for evaluation.
     */
    public int effectiveThreads() {
        return evaluationThreads > 0 ? evaluationThreads : Runtime.getRuntime().availableProcessors();
    }
    
    /**
     * Builder pre-filled with the values of this config.
     */
    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .elitism(elitism)
                .immigrants(immigrants)
                .mutationRate(mutationRate)
                .crossoverRate(crossoverRate)
                .minLength(minLength)
                .maxLength(maxLength)
                .variableSlots(variableSlots)
                .literalMin(literalMin)
                .literalMax(literalMax)
                .allowJumps(allowJumps)
                .maxGenerations(maxGenerations)
                .stepLimit(stepLimit)
                .stagnationWindow(stagnationWindow)
                .selectionStrategy(selectionStrategy)
                .tournamentSize(tournamentSize)
                .fitnessThreshold(fitnessThreshold)
                .parsimonyPenalty(parsimonyPenalty)
                .scoring(scoring)
                .randomSeed(randomSeed)
                .evaluationThreads(evaluationThreads)
                .reportInterval(reportInterval);
    }
    
    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int populationSize = 200;
        private int elitism = 2;
        private double immigrants = 0.0;
        private double mutationRate = 0.8;
        private double crossoverRate = 0.7;
        private int minLength = 1;
        private int maxLength = 16;
        private int variableSlots = 4;
        private int literalMin = -10;
        private int literalMax = 10;
        private boolean allowJumps = true;
        private int maxGenerations = 200;
        private long stepLimit = 200;
        private int stagnationWindow = 0;
        private SelectionStrategy selectionStrategy = SelectionStrategy.TOURNAMENT;
        private int tournamentSize = 4;
        private double fitnessThreshold = 1.0;
        private double parsimonyPenalty = 0.0;
        private CaseScoring scoring = CaseScoring.DISTANCE;
        private long randomSeed = 0;
        private int evaluationThreads = 1;
        private int reportInterval = 10;
        
        public Builder populationSize(int size) { this.populationSize = size; return this; }
        public Builder elitism(int count) { this.elitism = count; return this; }
        public Builder immigrants(double fraction) { this.immigrants = fraction; return this; }
        public Builder mutationRate(double rate) { this.mutationRate = rate; return this; }
        public Builder crossoverRate(double rate) { this.crossoverRate = rate; return this; }
        public Builder minLength(int length) { this.minLength = length; return this; }
        public Builder maxLength(int length) { this.maxLength = length; return this; }
        public Builder variableSlots(int slots) { this.variableSlots = slots; return this; }
        public Builder literalMin(int min) { this.literalMin = min; return this; }
        public Builder literalMax(int max) { this.literalMax = max; return this; }
        public Builder allowJumps(boolean allow) { this.allowJumps = allow; return this; }
        public Builder maxGenerations(int max) { this.maxGenerations = max; return this; }
        public Builder stepLimit(long limit) { this.stepLimit = limit; return this; }
        public Builder stagnationWindow(int window) { this.stagnationWindow = window; return this; }
        public Builder selectionStrategy(SelectionStrategy strategy) { this.selectionStrategy = strategy; return this; }
        public Builder tournamentSize(int size) { this.tournamentSize = size; return this; }
        public Builder fitnessThreshold(double threshold) { this.fitnessThreshold = threshold; return this; }
        public Builder parsimonyPenalty(double penalty) { this.parsimonyPenalty = penalty; return this; }
        public Builder scoring(CaseScoring scoring) { this.scoring = scoring; return this; }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder evaluationThreads(int threads) { this.evaluationThreads = threads; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }
        
        /**
         * @throws ConfigurationException if any value is out of range
         */
        public EvolutionConfig build() {
            return new EvolutionConfig(
                populationSize, elitism, immigrants, mutationRate, crossoverRate,
                minLength, maxLength, variableSlots, literalMin, literalMax, allowJumps,
                maxGenerations, stepLimit, stagnationWindow,
                selectionStrategy, tournamentSize,
                fitnessThreshold, parsimonyPenalty, scoring,
                randomSeed, evaluationThreads, reportInterval
            );
        }
    }
    
    @Override
    public String toString() {
        return String.format("""
            EvolutionConfig:
              population.size:          %,d
              population.elitism:       %d
              population.immigrants:    %.2f
              genetic.mutation-rate:    %.2f
              genetic.crossover-rate:   %.2f
              program.length:           [%d, %d]
              program.variable-slots:   %d
              program.literals:         [%d, %d]
              program.allow-jumps:      %s
              limits.max-generations:   %,d
              limits.step-limit:        %,d
              limits.stagnation-window: %s
              selection:                %s (tournament size %d)
              fitness.threshold:        %.4f
              fitness.parsimony:        %.5f
              fitness.scoring:          %s
              random.seed:              %s
              evaluation.threads:       %s
              reporting.interval:       %,d generations
            """,
            populationSize,
            elitism,
            immigrants,
            mutationRate,
            crossoverRate,
            minLength, maxLength,
            variableSlots,
            literalMin, literalMax,
            allowJumps,
            maxGenerations,
            stepLimit,
            stagnationWindow == 0 ? "disabled" : String.format("%,d generations", stagnationWindow),
            selectionStrategy.name().toLowerCase(Locale.ROOT), tournamentSize,
            fitnessThreshold,
            parsimonyPenalty,
            scoring.name().toLowerCase(Locale.ROOT),
            randomSeed == 0 ? "clock" : String.valueOf(randomSeed),
            evaluationThreads == 0 ? "auto" : String.valueOf(evaluationThreads),
            reportInterval
        );
    }
}
