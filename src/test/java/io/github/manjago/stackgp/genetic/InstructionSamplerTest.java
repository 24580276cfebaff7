package io.github.manjago.stackgp.genetic;

import io.github.manjago.stackgp.core.GameRng;
import io.github.manjago.stackgp.core.Instruction;
import io.github.manjago.stackgp.core.OpCode;
import io.github.manjago.stackgp.core.OperandKind;
import io.github.manjago.stackgp.core.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InstructionSamplerTest {
    
    @Test
    @DisplayName("Random programs respect the shape")
    void programsRespectShape() {
        ProgramShape shape = new ProgramShape(2, 8, 3, -5, 5, true);
        InstructionSampler sampler = new InstructionSampler(shape);
        GameRng rng = new GameRng(11);
        
        for (int i = 0; i < 500; i++) {
            Program p = sampler.randomProgram(rng);
            assertTrue(shape.acceptsLength(p.length()));
            assertEquals(3, p.variableSlots());
            for (Instruction ins : p.instructions()) {
                if (ins.op() == OpCode.PUSH) {
                    assertTrue(ins.operand() >= -5 && ins.operand() <= 5);
                }
            }
        }
    }
    
    @Test
    @DisplayName("Every allowed opcode eventually appears")
    void coversOpcodes() {
        InstructionSampler sampler = new InstructionSampler(new ProgramShape(1, 16, 4, -10, 10, true));
        GameRng rng = new GameRng(2);
        Set<OpCode> seen = EnumSet.noneOf(OpCode.class);
        
        for (int i = 0; i < 2000; i++) {
            seen.add(sampler.randomInstruction(rng, 10).op());
        }
        
        assertEquals(EnumSet.allOf(OpCode.class), seen);
    }
    
    @Test
    @DisplayName("Jumps are never drawn when disabled")
    void noJumps() {
        InstructionSampler sampler = new InstructionSampler(new ProgramShape(1, 16, 4, -10, 10, false));
        GameRng rng = new GameRng(3);
        
        for (int i = 0; i < 2000; i++) {
            assertFalse(sampler.randomInstruction(rng, 10).isJump());
        }
    }
    
    @Test
    @DisplayName("With no program to jump into, draws come from the jump-free opcodes")
    void noTargetsForEmptyProgram() {
        InstructionSampler sampler = new InstructionSampler(new ProgramShape(1, 16, 4, -10, 10, true));
        GameRng rng = new GameRng(6);
        Set<OpCode> seen = EnumSet.noneOf(OpCode.class);
        
        for (int i = 0; i < 2000; i++) {
            seen.add(sampler.randomInstruction(rng, 0).op());
        }
        
        assertEquals(EnumSet.copyOf(OpCode.jumpFree()), seen);
    }
    
    @Test
    @DisplayName("Slot instructions are never drawn without variables")
    void noSlots() {
        InstructionSampler sampler = new InstructionSampler(new ProgramShape(1, 16, 0, -10, 10, true));
        GameRng rng = new GameRng(4);
        
        for (int i = 0; i < 2000; i++) {
            assertNotEquals(OperandKind.SLOT, sampler.randomInstruction(rng, 10).op().getOperandKind());
        }
    }
    
    @Test
    @DisplayName("Arity-preserving draws keep the operand flag")
    void arity() {
        InstructionSampler sampler = new InstructionSampler(new ProgramShape(1, 16, 4, -10, 10, true));
        GameRng rng = new GameRng(5);
        
        for (int i = 0; i < 500; i++) {
            assertTrue(sampler.randomWithArity(rng, true, 6).op().hasOperand());
            assertFalse(sampler.randomWithArity(rng, false, 6).op().hasOperand());
        }
    }
    
    @Test
    @DisplayName("Invalid shapes are rejected")
    void invalidShape() {
        assertThrows(IllegalArgumentException.class, () -> new ProgramShape(0, 5, 4, 0, 1, true));
        assertThrows(IllegalArgumentException.class, () -> new ProgramShape(5, 4, 4, 0, 1, true));
        assertThrows(IllegalArgumentException.class, () -> new ProgramShape(1, 4, 4, 2, 1, true));
    }
}
