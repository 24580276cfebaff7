package io.github.manjago.stackgp.cli;

import io.github.manjago.stackgp.config.EvolutionConfig;
import io.github.manjago.stackgp.core.OpCode;
import io.github.manjago.stackgp.fitness.Problem;
import io.github.manjago.stackgp.problems.Problems;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about StackGP.
 */
@Command(
    name = "info",
    description = "Show version, instruction set and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {
    
    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              STACKGP                  ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
        
        System.out.println("Instruction set (ISA v" + OpCode.ISA_VERSION + "):");
        for (OpCode op : OpCode.values()) {
            String operand = op.hasOperand() ? " <" + op.getOperandKind().name().toLowerCase() + ">" : "";
            System.out.printf("  0x%02X  %s%s%n", op.getCode(), op.getMnemonic(), operand);
        }
        System.out.println();
        
        System.out.println("Default Configuration:");
        System.out.println(EvolutionConfig.defaults());
        
        System.out.println("Problems:");
        for (Problem p : Problems.all()) {
            System.out.printf("  %-16s %s (%d cases)%n", p.name(), p.description(), p.testCases().size());
        }
        System.out.println();
        
        return 0;
    }
}
