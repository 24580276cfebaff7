package io.github.manjago.stackgp.problems;

import io.github.manjago.stackgp.core.Assembler;
import io.github.manjago.stackgp.core.VirtualMachine;
import io.github.manjago.stackgp.fitness.FitnessEvaluator;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.fitness.TestCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ProblemsTest {
    
    @Test
    @DisplayName("Addition covers every pair of digits")
    void additionCases() {
        Problem addition = Problems.byName("addition");
        
        assertNotNull(addition);
        assertEquals(100, addition.testCases().size());
        assertTrue(addition.testCases().contains(TestCase.of(17, 8, 9)));
    }
    
    @Test
    @DisplayName("Lookup is case-insensitive and unknown names give null")
    void lookup() {
        assertSame(Problems.byName("square"), Problems.byName("SQUARE"));
        assertNull(Problems.byName("nope"));
        assertEquals(Problems.names().size(), Problems.all().size());
    }
    
    @ParameterizedTest
    @CsvSource({
        "addition,       ADD",
        "multiplication, MUL",
        "square,         DUP\\nMUL"
    })
    @DisplayName("Hand-written solutions score 1.0")
    void handWrittenSolutions(String name, String source) throws Exception {
        Problem problem = Problems.byName(name);
        FitnessEvaluator evaluator = new FitnessEvaluator(new VirtualMachine());
        
        assertEquals(1.0, evaluator.fitness(new Assembler().assemble(source.replace("\\n", "\n")), problem));
    }
    
    @Test
    @DisplayName("Cube-plus-one solution scores 1.0")
    void cubePlusOne() throws Exception {
        Problem problem = Problems.byName("cube-plus-one");
        String source = """
                DUP
                DUP
                MUL
                MUL
                PUSH 1
                ADD
                """;
        
        assertEquals(1.0, new FitnessEvaluator(new VirtualMachine())
                .fitness(new Assembler().assemble(source), problem));
    }
}
