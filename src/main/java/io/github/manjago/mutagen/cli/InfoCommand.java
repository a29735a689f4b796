package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.VariationConfig;
import io.github.manjago.mutagen.operators.GeneticOperator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Show information about Mutagen.
 */
@Command(
    name = "info",
    description = "Show version, operators and default configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {
    
    @Spec
    private CommandSpec spec;
    
    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println();
        out.println("╔═══════════════════════════════════════╗");
        out.println("║              MUTAGEN                  ║");
        out.println("║   Variation for genetic programs      ║");
        out.println("║          Version 1.0.0                ║");
        out.println("╚═══════════════════════════════════════╝");
        out.println();
        
        out.println("Operators:");
        for (GeneticOperator op : GeneticOperator.values()) {
            out.printf("  %-22s %d parent%s%n", op.getLabel(), op.getParents(), op.getParents() > 1 ? "s" : "");
        }
        out.println();
        
        out.println("Default Configuration:");
        out.println(VariationConfig.defaults());
        out.flush();
        return 0;
    }
}
