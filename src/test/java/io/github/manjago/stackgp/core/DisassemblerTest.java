package io.github.manjago.stackgp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.manjago.stackgp.core.Instruction.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Disassembler.
 */
class DisassemblerTest {
    
    @Test
    @DisplayName("Disassembled text assembles back to the same program")
    void roundTrip() throws Exception {
        Program original = Program.of(4,
                store(0), load(0), jz(5), push(-3), jmp(1), Instruction.of(OpCode.HALT));
        
        String text = Disassembler.disassemble(original);
        Program reassembled = new Assembler().assemble(text);
        
        assertEquals(original, reassembled);
    }
    
    @Test
    @DisplayName("Listing numbers each instruction")
    void listing() {
        Program p = Program.of(4, push(2), Instruction.of(OpCode.MUL));
        
        assertEquals("0000: PUSH 2\n0001: MUL", Disassembler.listing(p));
    }
    
    @Test
    @DisplayName("Empty program disassembles to empty text")
    void empty() {
        Program p = Program.of(4);
        
        assertEquals("", Disassembler.disassemble(p));
        assertEquals("", Disassembler.listing(p));
    }
}
