package io.github.manjago.mutagen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Mutagen CLI - try variation operators on programs from the command line.
 * 
 * Usage:
 *   mutagen vary &lt;operator&gt; &lt;program&gt; [&lt;program&gt;]  - Apply an operator
 *   mutagen info                                   - Show version and config
 */
@Command(
    name = "mutagen",
    description = "Variation operators for tree-structured genetic programs",
    mixinStandardHelpOptions = true,
    version = "Mutagen 1.0.0",
    subcommands = {
        VaryCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MutagenCli implements Runnable {
    
    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }
    
    /**
     * Command line with the options every entry point uses.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new MutagenCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
    
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
