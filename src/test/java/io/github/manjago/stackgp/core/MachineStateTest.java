package io.github.manjago.stackgp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MachineStateTest {
    
    @Test
    @DisplayName("Initial stack is pushed bottom first")
    void initialStack() {
        MachineState state = new MachineState(4, new int[]{1, 2, 3}, new int[]{9});
        
        assertEquals(3, state.depth());
        assertEquals(3, state.peek());
        assertArrayEquals(new int[]{9, 0, 0, 0}, state.variablesSnapshot());
    }
    
    @Test
    @DisplayName("Stack grows past its initial capacity")
    void growth() {
        MachineState state = new MachineState(0);
        for (int i = 0; i < 100; i++) {
            state.push(i);
        }
        
        assertEquals(100, state.depth());
        assertEquals(99, state.pop());
        assertEquals(98, state.peek());
    }
    
    @Test
    @DisplayName("Popping an empty stack is a programming error")
    void popEmpty() {
        MachineState state = new MachineState(1);
        
        assertTrue(state.isStackEmpty());
        assertThrows(IllegalStateException.class, state::pop);
        assertThrows(IllegalStateException.class, state::peek);
    }
    
    @Test
    @DisplayName("Too many variable presets are rejected")
    void tooManyPresets() {
        assertThrows(IllegalArgumentException.class,
                () -> new MachineState(1, new int[0], new int[]{1, 2}));
    }
    
    @Test
    @DisplayName("Copy is independent")
    void copyIsIndependent() {
        MachineState original = new MachineState(2, new int[]{5}, new int[]{7});
        original.setIp(3);
        
        MachineState copy = new MachineState(original);
        copy.push(6);
        copy.setVariable(0, 0);
        copy.advanceIp();
        
        assertEquals(1, original.depth());
        assertEquals(7, original.getVariable(0));
        assertEquals(3, original.getIp());
        assertEquals(4, copy.getIp());
    }
    
    @Test
    @DisplayName("Snapshots do not alias internal arrays")
    void snapshots() {
        MachineState state = new MachineState(1, new int[]{1, 2}, new int[0]);
        int[] snap = state.stackSnapshot();
        snap[0] = 42;
        
        assertArrayEquals(new int[]{1, 2}, state.stackSnapshot());
    }
}
