package io.github.manjago.stackgp.cli;

import io.github.manjago.stackgp.persistence.ResultStore;
import io.github.manjago.stackgp.persistence.StoredRun;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * List runs saved in a result store.
 * 
 * Examples:
 *   stackgp show runs.mv              # One line per run
 *   stackgp show runs.mv --run 3      # Program and fitness curve of run #3
 */
@Command(
    name = "show",
    description = "Show runs saved in a result store",
    mixinStandardHelpOptions = true
)
public class ShowCommand implements Callable<Integer> {
    
    @Parameters(index = "0", description = "Result store file")
    private Path dataFile;
    
    @Option(names = {"-r", "--run"}, description = "Show details of one run")
    private Integer runId;
    
    @Override
    public Integer call() {
        List<StoredRun> runs;
        try {
            runs = ResultStore.load(dataFile);
        } catch (IOException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
        
        if (runId == null) {
            if (runs.isEmpty()) {
                System.out.println("No runs in " + dataFile);
            }
            for (StoredRun run : runs) {
                System.out.println(run);
            }
            return 0;
        }
        
        StoredRun run = runs.stream().filter(r -> r.id() == runId).findFirst().orElse(null);
        if (run == null) {
            System.err.println("✗ No run #" + runId + " in " + dataFile);
            return 1;
        }
        
        System.out.println(run);
        System.out.println();
        System.out.println("Best program:");
        System.out.println(run.programText() != null ? run.programText() : "(none)");
        System.out.println();
        System.out.println("Best fitness per generation:");
        double[] curve = run.bestFitnessHistory();
        for (int g = 0; g < curve.length; g++) {
            System.out.printf("  %5d  %.4f%n", g, curve[g]);
        }
        return 0;
    }
}
