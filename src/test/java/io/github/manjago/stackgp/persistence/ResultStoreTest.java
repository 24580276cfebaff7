package io.github.manjago.stackgp.persistence;

import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.OpCode;
import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.evolution.EvolutionResult;
import io.github.manjago.stackgp.evolution.GenerationStats;
import io.github.manjago.stackgp.evolution.TerminationReason;
import io.github.manjago.stackgp.fitness.Evaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {
    
    @TempDir
    Path tempDir;
    
    private static GenerationStats stats(int generation, double best) {
        return new GenerationStats(generation, best, best / 2, 0.0, 3.0, 0, 100, 5, 1, 50, 50);
    }
    
    private static EvolutionResult solvedResult() {
        Program program = Program.of(4, Instruction.of(OpCode.ADD), Instruction.of(OpCode.HALT));
        Evaluation eval = new Evaluation(1.0, 100, 0, 0, 0, 100, 200);
        return new EvolutionResult(program, 1.0, eval, 2, 3, TerminationReason.SOLVED, 77L,
                List.of(stats(0, 0.4), stats(1, 0.7), stats(2, 1.0)));
    }
    
    @Test
    @DisplayName("Saved run reads back intact")
    void saveAndLoad() throws IOException {
        Path file = tempDir.resolve("runs.mv");
        
        int id = ResultStore.save(solvedResult(), "addition", file);
        List<StoredRun> runs = ResultStore.load(file);
        
        assertEquals(1, id);
        assertEquals(1, runs.size());
        StoredRun run = runs.get(0);
        assertEquals("addition", run.problem());
        assertEquals(TerminationReason.SOLVED, run.reason());
        assertEquals(77L, run.seed());
        assertEquals(1.0, run.bestFitness());
        assertEquals(2, run.foundGeneration());
        assertEquals(3, run.generations());
        assertEquals("ADD\nHALT", run.programText());
        assertArrayEquals(new double[]{0.4, 0.7, 1.0}, run.bestFitnessHistory());
        assertTrue(run.timestamp() > 0);
    }
    
    @Test
    @DisplayName("Runs accumulate in one file")
    void appends() throws IOException {
        Path file = tempDir.resolve("runs.mv");
        EvolutionResult cancelled = new EvolutionResult(null, Double.NaN, null, -1, 0,
                TerminationReason.CANCELLED, 5L, List.of());
        
        ResultStore.save(solvedResult(), "addition", file);
        int second = ResultStore.save(cancelled, "square", file);
        List<StoredRun> runs = ResultStore.load(file);
        
        assertEquals(2, second);
        assertEquals(2, runs.size());
        assertEquals("square", runs.get(1).problem());
        assertNull(runs.get(1).programText());
        assertTrue(Double.isNaN(runs.get(1).bestFitness()));
        assertEquals(0, runs.get(1).bestFitnessHistory().length);
    }
    
    @Test
    @DisplayName("Missing file is an I/O error")
    void missingFile() {
        assertThrows(IOException.class, () -> ResultStore.load(tempDir.resolve("nothing.mv")));
    }
    
    @Test
    @DisplayName("Foreign file is rejected")
    void foreignFile() throws IOException {
        Path file = tempDir.resolve("garbage.mv");
        Files.writeString(file, "not an mvstore file, just text that is long enough to be read");
        
        assertThrows(IOException.class, () -> ResultStore.load(file));
    }
}
