package io.github.manjago.mutagen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.operators.TypeComparison;
import io.github.manjago.mutagen.random.AtomGenerator;
import io.github.manjago.mutagen.random.NodeSelectionMethod;
import io.github.manjago.mutagen.random.Vocabulary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the variation engine.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record VariationConfig(
    // Size caps
    int maxPoints,
    int mutationMaxPoints,
    
    // Tags
    int tagLimit,
    List<TypeComparison> tagBranchComparisons,
    
    // Gaussian mutation
    double gaussianPerturbProbability,
    double gaussianStandardDeviation,
    
    // ULTRA
    double ultraAlternationRate,
    double ultraAlignmentDeviation,
    double ultraMutationRate,
    
    // Boolean geometric semantic crossover
    int gsxoverNewCodeMaxPoints,
    List<String> gsxoverInstructions,
    
    // Lineage
    boolean maintainAncestors,
    
    // Node selection
    NodeSelectionMethod nodeSelectionMethod,
    double nodeSelectionLeafProbability,
    int nodeSelectionTournamentSize,
    
    // Vocabulary
    List<String> instructions,
    List<Integer> integerErcRange,   // [min, max] or empty = none
    List<Double> floatErcRange,      // [min, max) or empty = none
    
    // Random
    long randomSeed                  // 0 = time-based
) {
    
    public VariationConfig {
        tagBranchComparisons = List.copyOf(tagBranchComparisons);
        gsxoverInstructions = List.copyOf(gsxoverInstructions);
        instructions = List.copyOf(instructions);
        integerErcRange = List.copyOf(integerErcRange);
        floatErcRange = List.copyOf(floatErcRange);
        if (maxPoints < 1) {
            throw new IllegalArgumentException("max-points must be positive: " + maxPoints);
        }
        requireRange("integer-erc", integerErcRange);
        requireRange("float-erc", floatErcRange);
    }
    
    private static void requireRange(String name, List<?> range) {
        if (!range.isEmpty() && range.size() != 2) {
            throw new IllegalArgumentException(name + " must be empty or [min, max]: " + range);
        }
    }
    
    /**
     * Load default configuration.
     */
    public static VariationConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }
    
    /**
     * Load configuration from a specific file.
     */
    public static VariationConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }
    
    /**
     * Load from Config object.
     */
    public static VariationConfig fromConfig(Config config) {
        Config c = config.getConfig("mutagen");
        
        List<TypeComparison> comparisons = new ArrayList<>();
        for (Config entry : c.getConfigList("tag-branch.comparisons")) {
            comparisons.add(new TypeComparison(entry.getString("type"), entry.getString("instruction")));
        }
        
        return new VariationConfig(
            c.getInt("max-points"),
            c.getInt("mutation.max-points"),
            c.getInt("tags.limit"),
            comparisons,
            c.getDouble("gaussian.perturb-probability"),
            c.getDouble("gaussian.standard-deviation"),
            c.getDouble("ultra.alternation-rate"),
            c.getDouble("ultra.alignment-deviation"),
            c.getDouble("ultra.mutation-rate"),
            c.getInt("boolean-gsxover.new-code-max-points"),
            c.getStringList("boolean-gsxover.instructions"),
            c.getBoolean("lineage.maintain-ancestors"),
            NodeSelectionMethod.fromConfigName(c.getString("node-selection.method")),
            c.getDouble("node-selection.leaf-probability"),
            c.getInt("node-selection.tournament-size"),
            c.getStringList("vocabulary.instructions"),
            c.getIntList("vocabulary.integer-erc"),
            c.getDoubleList("vocabulary.float-erc"),
            c.getLong("random.seed")
        );
    }
    
    /**
     * Seed to use: the configured one, or a time-based one when 0.
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime();
    }
    
    /**
     * Vocabulary for random code: the instructions plus the configured constants.
     */
    public Vocabulary vocabulary() {
        List<AtomGenerator> generators = new ArrayList<>();
        for (String name : instructions) {
            generators.add(AtomGenerator.constant(Atom.instruction(name)));
        }
        if (!integerErcRange.isEmpty()) {
            generators.add(AtomGenerator.integerErc(integerErcRange.get(0), integerErcRange.get(1)));
        }
        if (!floatErcRange.isEmpty()) {
            generators.add(AtomGenerator.floatErc(floatErcRange.get(0), floatErcRange.get(1)));
        }
        return new Vocabulary(generators);
    }
    
    /**
     * Vocabulary for the boolean condition of geometric semantic crossover.
     */
    public Vocabulary gsxoverVocabulary() {
        return Vocabulary.instructions(gsxoverInstructions);
    }
    
    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder pre-filled with this configuration, for overriding single values.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxPoints(maxPoints)
                .mutationMaxPoints(mutationMaxPoints)
                .tagLimit(tagLimit)
                .tagBranchComparisons(tagBranchComparisons)
                .gaussianPerturbProbability(gaussianPerturbProbability)
                .gaussianStandardDeviation(gaussianStandardDeviation)
                .ultraAlternationRate(ultraAlternationRate)
                .ultraAlignmentDeviation(ultraAlignmentDeviation)
                .ultraMutationRate(ultraMutationRate)
                .gsxoverNewCodeMaxPoints(gsxoverNewCodeMaxPoints)
                .gsxoverInstructions(gsxoverInstructions)
                .maintainAncestors(maintainAncestors)
                .nodeSelectionMethod(nodeSelectionMethod)
                .nodeSelectionLeafProbability(nodeSelectionLeafProbability)
                .nodeSelectionTournamentSize(nodeSelectionTournamentSize)
                .instructions(instructions)
                .integerErcRange(integerErcRange)
                .floatErcRange(floatErcRange)
                .randomSeed(randomSeed);
    }
    
    public static class Builder {
        private int maxPoints = 100;
        private int mutationMaxPoints = 20;
        private int tagLimit = 10_000;
        private List<TypeComparison> tagBranchComparisons = List.of(
                new TypeComparison("integer", "integer_eq"),
                new TypeComparison("boolean", "boolean_eq"));
        private double gaussianPerturbProbability = 0.5;
        private double gaussianStandardDeviation = 0.1;
        private double ultraAlternationRate = 0.01;
        private double ultraAlignmentDeviation = 10;
        private double ultraMutationRate = 0.01;
        private int gsxoverNewCodeMaxPoints = 20;
        private List<String> gsxoverInstructions = List.of(
                "boolean_and", "boolean_or", "boolean_not", "boolean_rand", "integer_eq", "integer_lt");
        private boolean maintainAncestors = false;
        private NodeSelectionMethod nodeSelectionMethod = NodeSelectionMethod.UNBIASED;
        private double nodeSelectionLeafProbability = 0.1;
        private int nodeSelectionTournamentSize = 2;
        private List<String> instructions = List.of(
                "integer_add", "integer_sub", "integer_mult", "integer_dup", "exec_if", "exec_dup");
        private List<Integer> integerErcRange = List.of(-10, 10);
        private List<Double> floatErcRange = List.of(-1.0, 1.0);
        private long randomSeed = 0;
        
        public Builder maxPoints(int max) { this.maxPoints = max; return this; }
        public Builder mutationMaxPoints(int max) { this.mutationMaxPoints = max; return this; }
        public Builder tagLimit(int limit) { this.tagLimit = limit; return this; }
        public Builder tagBranchComparisons(List<TypeComparison> pairs) { this.tagBranchComparisons = pairs; return this; }
        public Builder gaussianPerturbProbability(double p) { this.gaussianPerturbProbability = p; return this; }
        public Builder gaussianStandardDeviation(double sd) { this.gaussianStandardDeviation = sd; return this; }
        public Builder ultraAlternationRate(double rate) { this.ultraAlternationRate = rate; return this; }
        public Builder ultraAlignmentDeviation(double deviation) { this.ultraAlignmentDeviation = deviation; return this; }
        public Builder ultraMutationRate(double rate) { this.ultraMutationRate = rate; return this; }
        public Builder gsxoverNewCodeMaxPoints(int max) { this.gsxoverNewCodeMaxPoints = max; return this; }
        public Builder gsxoverInstructions(List<String> names) { this.gsxoverInstructions = names; return this; }
        public Builder maintainAncestors(boolean maintain) { this.maintainAncestors = maintain; return this; }
        public Builder nodeSelectionMethod(NodeSelectionMethod method) { this.nodeSelectionMethod = method; return this; }
        public Builder nodeSelectionLeafProbability(double p) { this.nodeSelectionLeafProbability = p; return this; }
        public Builder nodeSelectionTournamentSize(int size) { this.nodeSelectionTournamentSize = size; return this; }
        public Builder instructions(List<String> names) { this.instructions = names; return this; }
        public Builder integerErcRange(List<Integer> range) { this.integerErcRange = range; return this; }
        public Builder floatErcRange(List<Double> range) { this.floatErcRange = range; return this; }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        
        public VariationConfig build() {
            return new VariationConfig(
                maxPoints, mutationMaxPoints, tagLimit, tagBranchComparisons,
                gaussianPerturbProbability, gaussianStandardDeviation,
                ultraAlternationRate, ultraAlignmentDeviation, ultraMutationRate,
                gsxoverNewCodeMaxPoints, gsxoverInstructions,
                maintainAncestors,
                nodeSelectionMethod, nodeSelectionLeafProbability, nodeSelectionTournamentSize,
                instructions, integerErcRange, floatErcRange,
                randomSeed
            );
        }
    }
    
    @Override
    public String toString() {
        return String.format("""
            VariationConfig:
              max-points:                   %d
              mutation.max-points:          %d
              tags.limit:                   %,d
              tag-branch.comparisons:       %s
              gaussian.perturb-probability: %.3f
              gaussian.standard-deviation:  %.3f
              ultra.alternation-rate:       %.3f
              ultra.alignment-deviation:    %.2f
              ultra.mutation-rate:          %.3f
              boolean-gsxover.max-points:   %d
              lineage.maintain-ancestors:   %s
              node-selection:               %s (leaf p=%.2f, tournament=%d)
              vocabulary.instructions:      %s
              vocabulary.integer-erc:       %s
              vocabulary.float-erc:         %s
              random.seed:                  %s
            """,
            maxPoints,
            mutationMaxPoints,
            tagLimit,
            tagBranchComparisons,
            gaussianPerturbProbability,
            gaussianStandardDeviation,
            ultraAlternationRate,
            ultraAlignmentDeviation,
            ultraMutationRate,
            gsxoverNewCodeMaxPoints,
            maintainAncestors,
            nodeSelectionMethod.getConfigName(), nodeSelectionLeafProbability, nodeSelectionTournamentSize,
            instructions,
            integerErcRange.isEmpty() ? "none" : integerErcRange,
            floatErcRange.isEmpty() ? "none" : floatErcRange,
            randomSeed == 0 ? "time-based" : String.valueOf(randomSeed)
        );
    }
}
