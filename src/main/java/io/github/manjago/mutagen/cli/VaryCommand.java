package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.VariationConfig;
import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramReader;
import io.github.manjago.mutagen.core.ProgramReader.ProgramParseException;
import io.github.manjago.mutagen.core.ProgramWriter;
import io.github.manjago.mutagen.core.SeededRng;
import io.github.manjago.mutagen.engine.VariationEngine;
import io.github.manjago.mutagen.operators.GeneticOperator;
import io.github.manjago.mutagen.track.OperatorStats;
import io.github.manjago.mutagen.track.VariationTracker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: vary
 * 
 * Applies one operator to parent programs given as text and prints the children.
 * 
 * Examples:
 *   mutagen vary deletion "(a b (c d))"
 *   mutagen vary ultra "(1 2 (3 4))" "(a (b c) d)" -n 5 --seed 42
 *   mutagen vary mutation "(integer_add 1 2)" --config my.conf
 */
@Command(
    name = "vary",
    description = "Apply a variation operator to one or two programs",
    mixinStandardHelpOptions = true
)
public class VaryCommand implements Callable<Integer> {
    
    @Spec
    private CommandSpec spec;
    
    @Parameters(index = "0", description = "Operator: mutation, deletion, add-parentheses, tagging, "
            + "tag-branch-insertion, gaussian, crossover, boolean-gsxover, ultra")
    private String operatorName;
    
    @Parameters(index = "1", description = "First parent program, e.g. \"(a b (c d))\"")
    private String firstProgram;
    
    @Parameters(index = "2", arity = "0..1", description = "Second parent program (recombinations only)")
    private String secondProgram;
    
    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;
    
    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = time-based)")
    private Long seed;
    
    @Option(names = {"-n", "--count"}, defaultValue = "1", description = "Number of children to produce")
    private int count;
    
    @Option(names = {"-m", "--max-points"}, description = "Size cap for children")
    private Integer maxPoints;
    
    @Option(names = {"-q", "--quiet"}, description = "Print children only")
    private boolean quiet;
    
    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        
        GeneticOperator operator;
        try {
            operator = GeneticOperator.fromLabel(operatorName);
        } catch (IllegalArgumentException e) {
            err.println("❌ " + e.getMessage());
            return 1;
        }
        if (operator.isRecombination() && secondProgram == null) {
            err.println("❌ " + operator + " needs a second parent program");
            return 1;
        }
        
        Individual first;
        Individual second = null;
        try {
            ProgramReader reader = new ProgramReader();
            first = Individual.of(reader.read(firstProgram));
            if (secondProgram != null) {
                second = Individual.of(reader.read(secondProgram));
            }
        } catch (ProgramParseException e) {
            err.println("❌ Parse error: " + e.getMessage());
            return 1;
        }
        
        VariationConfig config = buildConfig();
        VariationTracker tracker = new VariationTracker();
        VariationEngine engine = new VariationEngine(config, new SeededRng(config.effectiveSeed()), tracker);
        
        if (!quiet) {
            out.printf("Operator: %s  |  seed: %d  |  max points: %d%n",
                    operator, engine.getSeed(), config.maxPoints());
            out.println();
        }
        
        for (int i = 0; i < count; i++) {
            Individual child = engine.apply(operator, first, second);
            Program program = child.program();
            if (quiet) {
                out.println(ProgramWriter.write(program));
            } else {
                String marker = child == first ? "  (rejected, parent kept)" : "";
                out.printf("%3d  [%d]  %s%s%n", i + 1, program.points(), ProgramWriter.write(program), marker);
            }
        }
        
        if (!quiet) {
            OperatorStats stats = tracker.getStats(operator);
            out.println();
            out.println(stats);
        }
        out.flush();
        return 0;
    }
    
    private VariationConfig buildConfig() {
        VariationConfig base = configFile != null
                ? VariationConfig.fromFile(configFile)
                : VariationConfig.defaults();
        VariationConfig.Builder builder = base.toBuilder();
        
        // Override from CLI options
        if (seed != null) builder.randomSeed(seed);
        if (maxPoints != null) builder.maxPoints(maxPoints);
        
        return builder.build();
    }
}
