package io.github.manjago.stackgp.core;

import org.jetbrains.annotations.NotNull;

/**
 * Disassembler for ISA v1.0
 * <p>
 * Converts programs to the text form accepted by {@link Assembler}.
 */
public final class Disassembler {
    
    private Disassembler() {
        // Utility class
    }
    
    /**
     * Disassemble a single instruction to mnemonic form.
     * 
     * @return assembly string like "PUSH 3" or "ADD"
     */
    public static @NotNull String disassemble(@NotNull Instruction instruction) {
        return instruction.toString();
    }
    
    /**
     * Disassemble a program, one instruction per line.
     * The result assembles back to an equal program.
     */
    public static @NotNull String disassemble(@NotNull Program program) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < program.length(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(disassemble(program.get(i)));
        }
        return sb.toString();
    }
    
    /**
     * Disassemble with instruction indices, for listings.
     * 
     * @return multi-line listing like {@code 0003: JZ 7}
     */
    public static @NotNull String listing(@NotNull Program program) {
        if (program.isEmpty()) {
            return "";
        }
        
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < program.length(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(String.format("%04d: %s", i, disassemble(program.get(i))));
        }
        return sb.toString();
    }
}
