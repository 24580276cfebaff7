package io.github.manjago.stackgp.persistence;

import io.github.manjago.stackgp.core.Disassembler;
import io.github.manjago.stackgp.evolution.EvolutionResult;
import io.github.manjago.stackgp.evolution.GenerationStats;
import io.github.manjago.stackgp.evolution.TerminationReason;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Archive of finished runs using H2 MVStore.
 * 
 * Several runs can share one file; each save appends a new run id.
 * 
 * Structure (all maps keyed by run id):
 * - "meta" map: format version and last run id
 * - "problem", "reason", "program": strings
 * - "seed", "timestamp": longs
 * - "fitness": best fitness
 * - "found", "generations": ints
 * - "history": best fitness per generation (double[])
 */
public final class ResultStore {
    
    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);
    
    private static final long VERSION = 1;
    
    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_LAST_ID = "last_id";
    
    private ResultStore() {
        // Utility class
    }
    
    /**
     * Append a run to the store, creating the file if needed.
     * 
     * @return id assigned to the run
     */
    public static int save(EvolutionResult result, String problemName, Path path) throws IOException {
        log.info("Saving run to {} (MVStore)", path);
        
        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {
            
            MVMap<String, Long> meta = store.openMap("meta");
            Long version = meta.putIfAbsent(KEY_VERSION, VERSION);
            if (version != null && version != VERSION) {
                throw new IOException("Unsupported result store version " + version + " in " + path);
            }
            int id = meta.getOrDefault(KEY_LAST_ID, 0L).intValue() + 1;
            meta.put(KEY_LAST_ID, (long) id);
            
            MVMap<Integer, String> problems = store.openMap("problem");
            MVMap<Integer, String> reasons = store.openMap("reason");
            MVMap<Integer, String> programs = store.openMap("program");
            MVMap<Integer, Long> seeds = store.openMap("seed");
            MVMap<Integer, Long> timestamps = store.openMap("timestamp");
            MVMap<Integer, Double> fitness = store.openMap("fitness");
            MVMap<Integer, Integer> found = store.openMap("found");
            MVMap<Integer, Integer> generations = store.openMap("generations");
            MVMap<Integer, double[]> history = store.openMap("history");
            
            problems.put(id, problemName);
            reasons.put(id, result.reason().name());
            if (result.bestProgram() != null) {
                programs.put(id, Disassembler.disassemble(result.bestProgram()));
            }
            seeds.put(id, result.seed());
            timestamps.put(id, System.currentTimeMillis());
            fitness.put(id, result.bestFitness());
            found.put(id, result.foundGeneration());
            generations.put(id, result.generations());
            history.put(id, result.history().stream().mapToDouble(GenerationStats::bestFitness).toArray());
            
            store.commit();
            log.info("Run #{} saved: {} after {} generations", id, result.reason(), result.generations());
            return id;
        } catch (MVStoreException e) {
            throw new IOException("Failed to write result store " + path, e);
        }
    }
    
    /**
     * Read all runs, ordered by id.
     */
    public static List<StoredRun> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Result store not found: " + path);
        }
        log.debug("Loading runs from {} (MVStore)", path);
        
        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .readOnly()
                .open()) {
            
            MVMap<String, Long> meta = store.openMap("meta");
            Long version = meta.get(KEY_VERSION);
            if (version == null || version != VERSION) {
                throw new IOException("Not a result store (version " + version + "): " + path);
            }
            int lastId = meta.getOrDefault(KEY_LAST_ID, 0L).intValue();
            
            MVMap<Integer, String> problems = store.openMap("problem");
            MVMap<Integer, String> reasons = store.openMap("reason");
            MVMap<Integer, String> programs = store.openMap("program");
            MVMap<Integer, Long> seeds = store.openMap("seed");
            MVMap<Integer, Long> timestamps = store.openMap("timestamp");
            MVMap<Integer, Double> fitness = store.openMap("fitness");
            MVMap<Integer, Integer> found = store.openMap("found");
            MVMap<Integer, Integer> generations = store.openMap("generations");
            MVMap<Integer, double[]> history = store.openMap("history");
            
            List<StoredRun> runs = new ArrayList<>(lastId);
            for (int id = 1; id <= lastId; id++) {
                runs.add(new StoredRun(
                    id,
                    problems.get(id),
                    TerminationReason.valueOf(reasons.get(id)),
                    seeds.get(id),
                    fitness.get(id),
                    found.get(id),
                    generations.get(id),
                    programs.get(id),
                    history.get(id),
                    timestamps.get(id)
                ));
            }
            return runs;
        } catch (MVStoreException e) {
            throw new IOException("Failed to read result store " + path, e);
        }
    }
}
