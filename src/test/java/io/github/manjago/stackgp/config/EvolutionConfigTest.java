package io.github.manjago.stackgp.config;

import com.typesafe.config.ConfigFactory;
import io.github.manjago.stackgp.evolution.SelectionStrategy;
import io.github.manjago.stackgp.fitness.CaseScoring;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionConfigTest {
    
    @Nested
    @DisplayName("Loading")
    class Loading {
        
        @Test
        @DisplayName("Defaults come from reference.conf and match the builder")
        void defaults() {
            EvolutionConfig config = EvolutionConfig.defaults();
            
            assertEquals(200, config.populationSize());
            assertEquals(2, config.elitism());
            assertEquals(0, config.immigrantCount());
            assertEquals(SelectionStrategy.TOURNAMENT, config.selectionStrategy());
            assertEquals(CaseScoring.DISTANCE, config.scoring());
            assertEquals(EvolutionConfig.builder().build(), config);
        }
        
        @Test
        @DisplayName("File values override defaults")
        void fromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("run.conf");
            Files.writeString(file, """
                    stackgp {
                      population.size = 50
                      selection.strategy = roulette
                      fitness.scoring = EXACT
                      random.seed = 42
                    }
                    """);
            
            EvolutionConfig config = EvolutionConfig.fromFile(file);
            
            assertEquals(50, config.populationSize());
            assertEquals(SelectionStrategy.ROULETTE, config.selectionStrategy());
            assertEquals(CaseScoring.EXACT, config.scoring());
            assertEquals(42, config.effectiveSeed());
            assertEquals(16, config.maxLength());
        }
        
        @Test
        @DisplayName("Missing file is a configuration error")
        void missingFile(@TempDir Path dir) {
            assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.fromFile(dir.resolve("absent.conf")));
        }
        
        @Test
        @DisplayName("Mistyped and unknown values are configuration errors")
        void badValues() {
            assertThrows(ConfigurationException.class, () -> EvolutionConfig.fromConfig(
                    ConfigFactory.parseString("stackgp.population.size = lots")
                            .withFallback(ConfigFactory.load())));
            assertThrows(ConfigurationException.class, () -> EvolutionConfig.fromConfig(
                    ConfigFactory.parseString("stackgp.selection.strategy = lottery")
                            .withFallback(ConfigFactory.load())));
        }
    }
    
    @Nested
    @DisplayName("Validation")
    class Validation {
        
        @Test
        @DisplayName("Every offending setting is reported")
        void collectsProblems() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () -> EvolutionConfig.builder()
                    .populationSize(0)
                    .mutationRate(1.5)
                    .minLength(5)
                    .maxLength(3)
                    .build());
            
            assertEquals(4, e.getProblems().size(), e.getProblems().toString());
        }
        
        @Test
        @DisplayName("Elitism larger than the population is rejected")
        void elitismTooLarge() {
            assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.builder().populationSize(3).elitism(4).build());
        }
        
        @Test
        @DisplayName("Immigrant fraction outside [0, 1] or crowding out the elites is rejected")
        void immigrantsOutOfRange() {
            assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.builder().immigrants(-0.1).build());
            assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.builder().immigrants(1.5).build());
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.builder().populationSize(10).elitism(2).immigrants(0.9).build());
            assertEquals(1, e.getProblems().size(), e.getProblems().toString());
            
            EvolutionConfig config = EvolutionConfig.builder().populationSize(10).elitism(2).immigrants(0.8).build();
            assertEquals(8, config.immigrantCount());
        }
        
        @Test
        @DisplayName("Zero step limit is rejected")
        void zeroStepLimit() {
            assertThrows(ConfigurationException.class, () -> EvolutionConfig.builder().stepLimit(0).build());
        }
        
        @Test
        @DisplayName("Negative parsimony penalty is rejected")
        void negativeParsimony() {
            assertThrows(ConfigurationException.class,
                    () -> EvolutionConfig.builder().parsimonyPenalty(-0.01).build());
        }
    }
    
    @Test
    @DisplayName("toBuilder round-trips every field")
    void toBuilder() {
        EvolutionConfig config = EvolutionConfig.builder()
                .populationSize(33)
                .immigrants(0.25)
                .allowJumps(false)
                .stagnationWindow(7)
                .randomSeed(9)
                .build();
        
        assertEquals(config, config.toBuilder().build());
    }
    
    @Test
    @DisplayName("Derived shape and threads")
    void derived() {
        EvolutionConfig config = EvolutionConfig.builder().evaluationThreads(0).maxLength(9).build();
        
        assertEquals(9, config.programShape().maxLength());
        assertTrue(config.effectiveThreads() >= 1);
    }
}
