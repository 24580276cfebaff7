package io.github.manjago.stackgp.cli;

import io.github.manjago.stackgp.core.Assembler;
import io.github.manjago.stackgp.core.Assembler.AssemblerException;
import io.github.manjago.stackgp.core.Disassembler;
import io.github.manjago.stackgp.core.ExecutionOutcome;
import io.github.manjago.stackgp.core.Program;
import io.github.manjago.stackgp.core.VirtualMachine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * CLI command: exec
 * 
 * Assembles a program and runs it once on the given initial stack.
 * 
 * Usage:
 *   stackgp exec add.sasm 2 3
 *   stackgp exec loop.sasm 7 --steps 10000 --listing
 */
@Command(
    name = "exec",
    description = "Assemble a program and run it on the given stack",
    mixinStandardHelpOptions = true
)
public class ExecCommand implements Callable<Integer> {
    
    @Parameters(index = "0", description = "Program source file")
    private Path inputFile;
    
    @Parameters(index = "1..*", description = "Initial stack values, bottom first")
    private int[] values = new int[0];
    
    @Option(names = {"--steps"}, defaultValue = "1000", description = "Step limit (default: ${DEFAULT-VALUE})")
    private long stepLimit;
    
    @Option(names = {"--slots"}, defaultValue = "4", description = "Variable slots (default: ${DEFAULT-VALUE})")
    private int variableSlots;
    
    @Option(names = {"-l", "--listing"}, description = "Print the assembled program")
    private boolean showListing;
    
    @Override
    public Integer call() {
        Program program;
        try {
            program = new Assembler(variableSlots).assembleFile(inputFile);
        } catch (AssemblerException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
        
        if (showListing) {
            System.out.println(Disassembler.listing(program));
            System.out.println();
        }
        
        VirtualMachine vm = new VirtualMachine(stepLimit);
        ExecutionOutcome outcome = vm.run(program, values);
        
        System.out.println("Input:   " + Arrays.toString(values));
        System.out.println("Outcome: " + outcome.status()
                + (outcome.fault() != null ? " (" + outcome.fault() + ")" : ""));
        System.out.println("Steps:   " + outcome.steps());
        System.out.println("Stack:   " + Arrays.toString(outcome.finalState().stackSnapshot()));
        System.out.println("Vars:    " + Arrays.toString(outcome.finalState().variablesSnapshot()));
        
        return outcome.isCompleted() ? 0 : 1;
    }
}
