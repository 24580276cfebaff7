package io.github.manjago.stackgp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OpCodeTest {
    
    @ParameterizedTest
    @EnumSource(OpCode.class)
    @DisplayName("fromMnemonic is case-insensitive")
    void mnemonicLookup(OpCode op) {
        assertSame(op, OpCode.fromMnemonic(op.getMnemonic().toLowerCase()));
    }
    
    @Test
    @DisplayName("Codes are unique")
    void uniqueCodes() {
        Set<Integer> seen = new HashSet<>();
        for (OpCode op : OpCode.values()) {
            assertTrue(seen.add(op.getCode()), "Duplicate code for " + op);
        }
    }
    
    @Test
    @DisplayName("Unknown mnemonic returns null")
    void unknown() {
        assertNull(OpCode.fromMnemonic("NOP"));
    }
    
    @Test
    @DisplayName("Operand kinds match the instruction set")
    void operandKinds() {
        assertEquals(OperandKind.LITERAL, OpCode.PUSH.getOperandKind());
        assertEquals(OperandKind.SLOT, OpCode.LOAD.getOperandKind());
        assertEquals(OperandKind.SLOT, OpCode.STORE.getOperandKind());
        assertEquals(OperandKind.TARGET, OpCode.JMP.getOperandKind());
        assertEquals(OperandKind.TARGET, OpCode.JZ.getOperandKind());
        assertFalse(OpCode.ADD.hasOperand());
        assertFalse(OpCode.HALT.hasOperand());
    }
    
    @Test
    @DisplayName("jumpFree excludes exactly JMP and JZ")
    void jumpFree() {
        assertEquals(OpCode.values().length - 2, OpCode.jumpFree().size());
        assertFalse(OpCode.jumpFree().contains(OpCode.JMP));
        assertFalse(OpCode.jumpFree().contains(OpCode.JZ));
        assertTrue(OpCode.JZ.isJump());
        assertFalse(OpCode.PUSH.isJump());
    }
}
