package io.github.manjago.stackgp.genetic;

import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.OpCode;
import io.github.manjago.stackgp.core.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.manjago.stackgp.core.Instruction.*;
import static org.junit.jupiter.api.Assertions.*;

class MutatorTest {
    
    private static final ProgramShape SHAPE = new ProgramShape(1, 12, 4, -10, 10, true);
    
    private Mutator mutator;
    
    @BeforeEach
    void setUp() {
        mutator = new Mutator(new InstructionSampler(SHAPE));
    }
    
    private static final Instruction ADD = Instruction.of(OpCode.ADD);
    private static final Instruction HALT = Instruction.of(OpCode.HALT);
    
    @Nested
    @DisplayName("Deterministic edits")
    class Edits {
        
        @Test
        @DisplayName("Delete before a jump target shifts it down")
        void deleteShiftsTarget() {
            Program p = Program.of(4, push(1), ADD, push(2), ADD, jz(4), HALT);
            
            Program child = Mutator.deleteAt(p, 2);
            
            assertEquals(5, child.length());
            assertEquals(jz(3), child.get(3));
        }
        
        @Test
        @DisplayName("Delete of the last instruction clamps targets to the new end")
        void deleteClampsTarget() {
            Program p = Program.of(4, jmp(2), ADD, HALT);
            
            Program child = Mutator.deleteAt(p, 2);
            
            assertEquals(jmp(1), child.get(0));
        }
        
        @Test
        @DisplayName("Delete of a jump's own target keeps it pointing at the successor")
        void deleteTargetItself() {
            Program p = Program.of(4, jz(2), ADD, push(3), HALT);
            
            Program child = Mutator.deleteAt(p, 2);
            
            assertEquals(jz(2), child.get(0));
            assertEquals(HALT, child.get(2));
        }
        
        @Test
        @DisplayName("Insert shifts targets at or after the insertion point")
        void insertShiftsTargets() {
            Program p = Program.of(4, jz(1), jmp(0), HALT);
            
            Program child = Mutator.insertAt(p, 1, push(5));
            
            assertEquals(List.of(jz(2), push(5), jmp(0), HALT), child.instructions());
        }
        
        @Test
        @DisplayName("Replace leaves the parent untouched")
        void replaceIsPure() {
            Program p = Program.of(4, push(1), ADD);
            
            Program child = Mutator.replaceAt(p, 0, push(9));
            
            assertEquals(push(1), p.get(0));
            assertEquals(push(9), child.get(0));
        }
    }
    
    @Nested
    @DisplayName("Feasible kinds")
    class Feasibility {
        
        @Test
        @DisplayName("No delete at minimum length, no insert at maximum")
        void lengthBounds() {
            Program single = Program.of(4, ADD);
            assertFalse(mutator.feasibleKinds(single).contains(MutationKind.DELETE));
            assertFalse(mutator.feasibleKinds(single).contains(MutationKind.OPERAND));
            
            Instruction[] full = new Instruction[SHAPE.maxLength()];
            Arrays.fill(full, push(1));
            Program longest = Program.of(4, full);
            assertFalse(mutator.feasibleKinds(longest).contains(MutationKind.INSERT));
            assertTrue(mutator.feasibleKinds(longest).contains(MutationKind.OPERAND));
        }
    }
    
    @Test
    @DisplayName("Mutants are always valid and within bounds")
    void validityClosure() {
        InstructionSampler sampler = new InstructionSampler(SHAPE);
        for (int seed = 0; seed < 500; seed++) {
            GameRng rng = new GameRng(seed);
            Program program = sampler.randomProgram(rng);
            for (int i = 0; i < 20; i++) {
                program = mutator.mutate(program, rng);
                assertTrue(SHAPE.acceptsLength(program.length()));
                // Re-validate through the public constructor
                assertEquals(program, Program.of(program.instructions(), program.variableSlots()));
            }
        }
    }
    
    @Test
    @DisplayName("Mutation is deterministic for a given stream")
    void deterministic() {
        Program p = Program.of(4, push(1), ADD, jz(0), HALT);
        
        assertEquals(mutator.mutate(p, new GameRng(9)), mutator.mutate(p, new GameRng(9)));
    }
    
    @Test
    @DisplayName("Unmutatable program fails with a repair error")
    void repairFailure() {
        // Every edit of a 3-instruction program stays outside a 1-instruction shape
        ProgramShape tiny = new ProgramShape(1, 1, 0, 0, 0, false);
        Mutator tinyMutator = new Mutator(new InstructionSampler(tiny));
        Program outOfShape = Program.of(0, ADD, ADD, ADD);
        
        assertThrows(OperatorRepairException.class, () -> tinyMutator.mutate(outOfShape, new GameRng(1)));
    }
}
