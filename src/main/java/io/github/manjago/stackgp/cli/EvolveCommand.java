package io.github.manjago.stackgp.cli;

import io.github.manjago.stackgp.config.ConfigurationException;
import io.github.manjago.stackgp.config.EvolutionConfig;
import io.github.manjago.stackgp.core.Disassembler;
import io.github.manjago.stackgp.evolution.*;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.persistence.ResultStore;
import io.github.manjago.stackgp.problems.Problems;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Evolve a program for one of the built-in problems.
 * 
 * Examples:
 *   stackgp evolve                               # addition with defaults
 *   stackgp evolve -p square -g 500              # 500 generations
 *   stackgp evolve --config my.conf --seed 42    # custom config, fixed seed
 *   stackgp evolve -o runs.mv                    # archive the result
 */
@Command(
    name = "evolve",
    description = "Evolve a program for a problem",
    mixinStandardHelpOptions = true
)
public class EvolveCommand implements Callable<Integer> {
    
    private static final Logger log = LoggerFactory.getLogger(EvolveCommand.class);
    
    static final int EXIT_SOLVED = 0;
    static final int EXIT_UNSOLVED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    
    @Option(names = {"-p", "--problem"}, defaultValue = "addition",
            description = "Problem name (default: ${DEFAULT-VALUE})")
    private String problemName;
    
    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;
    
    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = clock)")
    private Long seed;
    
    @Option(names = {"-g", "--generations"}, description = "Max generations")
    private Integer maxGenerations;
    
    @Option(names = {"-n", "--population"}, description = "Population size")
    private Integer populationSize;
    
    @Option(names = {"-t", "--threads"}, description = "Evaluation threads (0 = all cores)")
    private Integer threads;
    
    @Option(names = {"-o", "--output"}, description = "Result store file to append the run to")
    private Path outputFile;
    
    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;
    
    @Override
    public Integer call() {
        Problem problem = Problems.byName(problemName);
        if (problem == null) {
            System.err.println("Unknown problem: " + problemName + " (available: " + Problems.names() + ")");
            return EXIT_CONFIG_ERROR;
        }
        
        EvolutionConfig config;
        try {
            config = buildConfig();
        } catch (ConfigurationException e) {
            return reportConfigError(e);
        }
        
        if (!quiet) {
            printBanner();
            System.out.println("Problem: " + problem.name() + " (" + problem.description() + ", "
                    + problem.testCases().size() + " cases)");
            System.out.println();
            System.out.println(config);
        }
        
        EvolutionResult result;
        long startTime = System.currentTimeMillis();
        try (EvolutionEngine engine = new EvolutionEngine(config, problem)) {
            // Setup graceful shutdown
            Thread hook = new Thread(() -> {
                if (engine.isRunning()) {
                    System.out.println("\nStopping gracefully...");
                    engine.stop();
                }
            });
            
            if (!quiet) {
                engine.setListener(new ConsoleProgressListener());
                System.out.printf("Seed: %d%n%n", engine.getSeed());
            }
            
            result = runWithShutdownHook(engine, hook);
        } catch (ConfigurationException e) {
            return reportConfigError(e);
        }
        long elapsed = System.currentTimeMillis() - startTime;
        
        printFinalReport(result, elapsed);
        
        if (outputFile != null) {
            try {
                int id = ResultStore.save(result, problem.name(), outputFile);
                System.out.printf("Saved as run #%d in %s%n", id, outputFile);
            } catch (IOException e) {
                System.err.println("Failed to save result: " + e.getMessage());
            }
        }
        
        return result.isSolved() ? EXIT_SOLVED : EXIT_UNSOLVED;
    }
    
    private EvolutionConfig buildConfig() {
        EvolutionConfig base = configFile != null
                ? EvolutionConfig.fromFile(configFile)
                : EvolutionConfig.defaults();
        
        // Override from CLI options
        EvolutionConfig.Builder builder = base.toBuilder();
        if (seed != null) builder.randomSeed(seed);
        if (maxGenerations != null) builder.maxGenerations(maxGenerations);
        if (populationSize != null) builder.populationSize(populationSize);
        if (threads != null) builder.evaluationThreads(threads);
        
        return builder.build();
    }
    
    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              STACKGP                  ║");
        System.out.println("║   Stack Program Synthesis by Evolution║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }
    
    private static int reportConfigError(ConfigurationException e) {
        System.err.println("Configuration error:");
        for (String p : e.getProblems()) {
            System.err.println("  - " + p);
        }
        return EXIT_CONFIG_ERROR;
    }
    
    /**
     * Runs the engine with {@code hook} registered; the hook is removed however the run ends.
     */
    static EvolutionResult runWithShutdownHook(EvolutionEngine engine, Thread hook) {
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return engine.run();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown hook left in place, JVM is already shutting down");
            }
        }
    }
    
    private void printFinalReport(EvolutionResult result, long elapsedMs) {
        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("          EVOLUTION COMPLETE           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();
        
        System.out.printf("Result:      %s%n", result.reason());
        System.out.printf("Time:        %s (%d generations)%n", formatDuration(elapsedMs), result.generations());
        System.out.printf("Seed:        %d%n", result.seed());
        
        if (!result.hasProgram()) {
            System.out.println("No program was evaluated.");
            return;
        }
        
        System.out.printf("Fitness:     %.4f (found in generation %d)%n",
                result.bestFitness(), result.foundGeneration());
        System.out.printf("Exact cases: %d / %d%n",
                result.bestEvaluation().exactCases(), result.bestEvaluation().totalCases());
        System.out.println();
        System.out.println("Best program:");
        System.out.println(Disassembler.listing(result.bestProgram()));
        System.out.println();
    }
    
    private String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }
    
    /**
     * Console progress listener with live updates.
     */
    private static class ConsoleProgressListener implements EvolutionListener {
        private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};
        private int spinnerIdx = 0;
        
        @Override
        public void onProgress(GenerationStats stats) {
            String spinner = SPINNER[spinnerIdx++ % SPINNER.length];
            
            // Compact one-line progress
            System.out.printf("\r%s Gen %,d  |  best %.4f (%d/%d)  |  mean %.4f  |  len %.1f  |  faulting %.0f%%   ",
                    spinner,
                    stats.generation(),
                    stats.bestFitness(),
                    stats.bestExactCases(), stats.totalCases(),
                    stats.meanFitness(),
                    stats.meanLength(),
                    stats.faultFraction() * 100);
            System.out.flush();
        }
        
        @Override
        public void onImprovement(Individual best, int generation) {
            System.out.printf("%n★ Generation %,d: new best %.4f (%d instructions)%n",
                    generation, best.getFitness(), best.getProgram().length());
        }
    }
}
