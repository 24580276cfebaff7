package io.github.manjago.stackgp.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * StackGP CLI - evolve and run stack-machine programs.
 * 
 * Usage:
 *   stackgp evolve [options]          - Evolve a program for a problem
 *   stackgp exec <file> [values...]   - Assemble and run a program
 *   stackgp show <file>               - List runs saved in a result store
 *   stackgp info                      - Show version, ISA and config
 */
@Command(
    name = "stackgp",
    description = "Evolutionary synthesis of stack-machine programs",
    mixinStandardHelpOptions = true,
    version = "StackGP 1.0.0",
    subcommands = {
        EvolveCommand.class,
        ExecCommand.class,
        ShowCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class StackGpCli implements Runnable {
    
    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StackGpCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
