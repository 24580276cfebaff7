package io.github.manjago.stackgp.integration;

import io.github.manjago.stackgp.config.EvolutionConfig;
import io.github.manjago.stackgp.core.Assembler;
import io.github.manjago.stackgp.core.ExecutionOutcome;
import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.core.VirtualMachine;
import io.github.manjago.stackgp.evolution.EvolutionEngine;
import io.github.manjago.stackgp.evolution.EvolutionResult;
import io.github.manjago.stackgp.evolution.TerminationReason;
import io.github.manjago.stackgp.fitness.FitnessEvaluator;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.persistence.ResultStore;
import io.github.manjago.stackgp.persistence.StoredRun;
import io.github.manjago.stackgp.problems.Problems;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke tests for the assemble, run, evolve and archive path.
 */
@DisplayName("Smoke Tests")
class SmokeTest {

    @TempDir
    Path tempDir;

    /** Hand-written looping program (loaded from test resources) */
    private static Program doubler;

    @BeforeAll
    static void loadDoubler() throws Exception {
        try (InputStream is = SmokeTest.class.getResourceAsStream("/double-loop.sasm")) {
            assertNotNull(is, "double-loop.sasm should be in test resources");
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String source = reader.lines().collect(Collectors.joining("\n"));
                doubler = new Assembler().assemble(source);
            }
        }
    }

    @Test
    @DisplayName("Looping program runs to completion")
    void loopingProgramRuns() {
        VirtualMachine vm = new VirtualMachine();

        for (int x = 0; x <= 20; x++) {
            ExecutionOutcome out = vm.run(doubler, x);
            assertTrue(out.isCompleted(), "x=" + x + ": " + out);
            assertEquals(2 * x, out.topOfStack().getAsInt());
        }
    }

    @Test
    @DisplayName("Looping program times out on negative input")
    void loopingProgramTimesOut() {
        ExecutionOutcome out = new VirtualMachine(500).run(doubler, -1);

        assertTrue(out.isTimedOut());
        assertEquals(500, out.steps());
    }

    @Test
    @DisplayName("Hand-written program is a perfect individual")
    void handWrittenScoresPerfectly() {
        Problem doubling = Problems.unary("doubling", "x -> 2x", 0, 9, x -> 2 * x);

        assertEquals(1.0, new FitnessEvaluator(new VirtualMachine()).fitness(doubler, doubling));
    }

    @Test
    @DisplayName("Evolve, save and reload a run")
    void evolveSaveLoad() throws Exception {
        EvolutionConfig config = EvolutionConfig.builder()
                .populationSize(100)
                .maxLength(8)
                .maxGenerations(100)
                .stepLimit(100)
                .randomSeed(2024)
                .build();
        Problem addition = Problems.byName("addition");

        EvolutionResult result;
        try (EvolutionEngine engine = new EvolutionEngine(config, addition)) {
            result = engine.run();
        }

        assertEquals(TerminationReason.SOLVED, result.reason());

        Path file = tempDir.resolve("runs.mv");
        ResultStore.save(result, addition.name(), file);
        List<StoredRun> runs = ResultStore.load(file);

        assertEquals(1, runs.size());
        Program reloaded = new Assembler().assemble(runs.get(0).programText());
        assertEquals(result.bestProgram(), reloaded);
        assertEquals(1.0, new FitnessEvaluator(new VirtualMachine()).fitness(reloaded, addition));
    }
}
