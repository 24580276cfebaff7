package io.github.manjago.stackgp.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembler for ISA v1.0.
 * 
 * Converts text assembly to a validated {@link Program}.
 * 
 * <h2>Syntax:</h2>
 * <pre>
 * ; Comment (from ; to end of line)
 * label:           ; Label definition
 * MNEMONIC [operand]
 * </pre>
 * 
 * <h2>Example:</h2>
 * <pre>
 * ; sum of the two inputs, counting down in slot 0
 *     STORE 0
 * loop:
 *     LOAD 0
 *     JZ done
 *     PUSH 1
 *     ADD
 *     LOAD 0
 *     PUSH 1
 *     SUB
 *     STORE 0
 *     JMP loop
 * done:
 *     HALT
 * </pre>
 * 
 * Jump operands are absolute instruction indices or labels.
 */
public class Assembler {
    
    private static final Logger log = LoggerFactory.getLogger(Assembler.class);
    
    // Regex patterns
    private static final Pattern COMMENT_PATTERN = Pattern.compile(";.*$");
    private static final Pattern LABEL_DEF_PATTERN = Pattern.compile("^\\s*(\\w+):\\s*$");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[+-]?\\d+");
    
    private final int variableSlots;
    
    public Assembler() {
        this(Program.DEFAULT_VARIABLE_SLOTS);
    }
    
    /**
     * @param variableSlots variable bank size the assembled programs are validated against
     */
    public Assembler(int variableSlots) {
        this.variableSlots = variableSlots;
    }
    
    /**
     * Assemble source code from string.
     * 
     * @param source assembly source code
     * @return validated program
     * @throws AssemblerException if syntax error or the program is malformed
     */
    public Program assemble(String source) throws AssemblerException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(source))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new AssemblerException("Failed to read source", e);
        }
        
        return assembleLines(lines);
    }
    
    /**
     * Assemble source code from file.
     * 
     * @param path path to .sasm file
     * @return validated program
     * @throws AssemblerException if syntax error or IO error
     */
    public Program assembleFile(Path path) throws AssemblerException {
        try {
            List<String> lines = Files.readAllLines(path);
            return assembleLines(lines);
        } catch (IOException e) {
            throw new AssemblerException("Failed to read file: " + path, e);
        }
    }
    
    /**
     * Two-pass assembly:
     * 1. First pass: collect labels and their addresses
     * 2. Second pass: build instructions, resolve label references
     */
    private Program assembleLines(List<String> lines) throws AssemblerException {
        // First pass: collect labels
        Map<String, Integer> labels = new HashMap<>();
        List<ParsedLine> parsed = new ArrayList<>();
        int address = 0;
        
        for (int lineNum = 0; lineNum < lines.size(); lineNum++) {
            String stripped = stripComment(lines.get(lineNum)).trim();
            
            if (stripped.isEmpty()) {
                continue;
            }
            
            Matcher labelMatcher = LABEL_DEF_PATTERN.matcher(stripped);
            if (labelMatcher.matches()) {
                String labelName = labelMatcher.group(1).toLowerCase();
                if (labels.containsKey(labelName)) {
                    throw new AssemblerException("Duplicate label: " + labelName, lineNum + 1);
                }
                labels.put(labelName, address);
                log.debug("Label '{}' at address {}", labelName, address);
                continue;
            }
            
            parsed.add(new ParsedLine(lineNum + 1, address, stripped));
            address++;
        }
        
        // Second pass: build instructions
        List<Instruction> code = new ArrayList<>(parsed.size());
        for (ParsedLine pl : parsed) {
            code.add(assembleLine(pl, labels));
        }
        
        try {
            Program program = Program.of(code, variableSlots);
            log.debug("Assembled {} instructions from {} lines", code.size(), lines.size());
            return program;
        } catch (MalformedProgramException e) {
            int pos = e.getPosition();
            int lineNum = pos >= 0 && pos < parsed.size() ? parsed.get(pos).lineNum() : -1;
            throw lineNum > 0
                    ? new AssemblerException(e.getMessage(), lineNum, e)
                    : new AssemblerException(e.getMessage(), e);
        }
    }
    
    private String stripComment(String line) {
        return COMMENT_PATTERN.matcher(line).replaceAll("");
    }
    
    /**
     * Assemble single instruction line.
     */
    private Instruction assembleLine(ParsedLine pl, Map<String, Integer> labels) throws AssemblerException {
        String[] tokens = pl.content().split("[,\\s]+");
        String mnemonic = tokens[0].toUpperCase();
        
        OpCode op = OpCode.fromMnemonic(mnemonic);
        if (op == null) {
            throw new AssemblerException("Unknown instruction: " + mnemonic, pl.lineNum());
        }
        
        if (!op.hasOperand()) {
            if (tokens.length > 1) {
                throw new AssemblerException(mnemonic + " takes no operand", pl.lineNum());
            }
            return Instruction.of(op);
        }
        
        if (tokens.length < 2) {
            throw new AssemblerException("Not enough operands. Usage: " + usage(op), pl.lineNum());
        }
        if (tokens.length > 2) {
            throw new AssemblerException("Too many operands. Usage: " + usage(op), pl.lineNum());
        }
        
        int operand = switch (op.getOperandKind()) {
            case TARGET -> parseTargetOrLabel(tokens[1], labels, pl.lineNum());
            default -> parseNumber(tokens[1], pl.lineNum());
        };
        return Instruction.of(op, operand);
    }
    
    private static String usage(OpCode op) {
        String operand = switch (op.getOperandKind()) {
            case LITERAL -> " value";
            case SLOT -> " slot";
            case TARGET -> " index|label";
            case NONE -> "";
        };
        return op.getMnemonic() + operand;
    }
    
    private int parseNumber(String token, int lineNum) throws AssemblerException {
        String trimmed = token.trim();
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
            throw new AssemblerException("Invalid number: " + token, lineNum);
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new AssemblerException("Number out of 32-bit range: " + token, lineNum);
        }
    }
    
    /**
     * Parse absolute target (numeric) or label reference.
     */
    private int parseTargetOrLabel(String token, Map<String, Integer> labels, int lineNum)
            throws AssemblerException {
        String trimmed = token.trim();
        
        if (NUMBER_PATTERN.matcher(trimmed).matches()) {
            return parseNumber(trimmed, lineNum);
        }
        
        Integer target = labels.get(trimmed.toLowerCase());
        if (target == null) {
            throw new AssemblerException("Undefined label: " + trimmed, lineNum);
        }
        return target;
    }
    
    // ========== Helper classes ==========
    
    private record ParsedLine(int lineNum, int address, String content) {}
    
    /**
     * Exception during assembly.
     */
    public static class AssemblerException extends Exception {
        private final int lineNum;
        
        public AssemblerException(String message) {
            super(message);
            this.lineNum = -1;
        }
        
        public AssemblerException(String message, int lineNum) {
            super("Line " + lineNum + ": " + message);
            this.lineNum = lineNum;
        }
        
        public AssemblerException(String message, Throwable cause) {
            super(message, cause);
            this.lineNum = -1;
        }
        
        public AssemblerException(String message, int lineNum, Throwable cause) {
            super("Line " + lineNum + ": " + message, cause);
            this.lineNum = lineNum;
        }
        
        public int getLineNum() {
            return lineNum;
        }
    }
}
