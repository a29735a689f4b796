package io.github.manjago.mutagen.engine;

import io.github.manjago.mutagen.config.VariationConfig;
import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.SeededRng;
import io.github.manjago.mutagen.operators.BooleanGsxover;
import io.github.manjago.mutagen.operators.CommitPolicy;
import io.github.manjago.mutagen.operators.Crossover;
import io.github.manjago.mutagen.operators.DeletionMutation;
import io.github.manjago.mutagen.operators.GaussianMutation;
import io.github.manjago.mutagen.operators.GeneticOperator;
import io.github.manjago.mutagen.operators.Mutation;
import io.github.manjago.mutagen.operators.ParenthesesMutation;
import io.github.manjago.mutagen.operators.PointMutation;
import io.github.manjago.mutagen.operators.Recombination;
import io.github.manjago.mutagen.operators.TagBranchInsertion;
import io.github.manjago.mutagen.operators.TaggingMutation;
import io.github.manjago.mutagen.operators.Ultra;
import io.github.manjago.mutagen.random.CodeGenerator;
import io.github.manjago.mutagen.random.NodeSelector;
import io.github.manjago.mutagen.random.RandomCodeGenerator;
import io.github.manjago.mutagen.random.Vocabulary;
import io.github.manjago.mutagen.track.VariationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for the evolutionary loop: every variation operator, wired from one
 * configuration and one random stream.
 * 
 * An engine is not thread-safe because its random stream is not. Give each worker
 * its own engine via {@link #fork()}; forks share the configuration and listener.
 */
public class VariationEngine {
    
    private static final Logger log = LoggerFactory.getLogger(VariationEngine.class);
    
    private final VariationConfig config;
    private final SeededRng rng;
    private final VariationListener listener;
    
    private final Map<GeneticOperator, Mutation> mutations = new EnumMap<>(GeneticOperator.class);
    private final Map<GeneticOperator, Recombination> recombinations = new EnumMap<>(GeneticOperator.class);
    
    public VariationEngine(VariationConfig config) {
        this(config, new SeededRng(config.effectiveSeed()), VariationListener.NOOP);
    }
    
    public VariationEngine(VariationConfig config, SeededRng rng, VariationListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.rng = Objects.requireNonNull(rng, "rng");
        this.listener = listener != null ? listener : VariationListener.NOOP;
        wireOperators();
        log.info("Variation engine created (seed: {}, max points: {}, node selection: {})",
                rng.getInitialSeed(), config.maxPoints(), config.nodeSelectionMethod().getConfigName());
    }
    
    private void wireOperators() {
        int maxPoints = config.maxPoints();
        CommitPolicy policy = new CommitPolicy(config.maintainAncestors(), listener);
        NodeSelector selector = config.nodeSelectionMethod().create(
                rng, config.nodeSelectionLeafProbability(), config.nodeSelectionTournamentSize());
        CodeGenerator generator = new RandomCodeGenerator(rng);
        Vocabulary vocabulary = config.vocabulary();
        
        mutations.put(GeneticOperator.MUTATION, new PointMutation(
                selector, generator, vocabulary, config.mutationMaxPoints(), maxPoints, policy));
        mutations.put(GeneticOperator.DELETION, new DeletionMutation(rng, maxPoints, policy));
        mutations.put(GeneticOperator.ADD_PARENTHESES, new ParenthesesMutation(rng, maxPoints, policy));
        mutations.put(GeneticOperator.TAGGING, new TaggingMutation(
                selector, rng, config.tagLimit(), maxPoints, policy));
        mutations.put(GeneticOperator.TAG_BRANCH_INSERTION, new TagBranchInsertion(
                rng, config.tagBranchComparisons(), config.tagLimit(), maxPoints, policy));
        mutations.put(GeneticOperator.GAUSSIAN, new GaussianMutation(
                rng, config.gaussianPerturbProbability(), config.gaussianStandardDeviation(), maxPoints, policy));
        
        recombinations.put(GeneticOperator.CROSSOVER, new Crossover(selector, maxPoints, policy));
        recombinations.put(GeneticOperator.BOOLEAN_GSXOVER, new BooleanGsxover(
                generator, config.gsxoverVocabulary(), config.gsxoverNewCodeMaxPoints(), maxPoints, policy));
        recombinations.put(GeneticOperator.ULTRA, new Ultra(
                rng, vocabulary, config.ultraAlternationRate(), config.ultraAlignmentDeviation(),
                config.ultraMutationRate(), maxPoints, policy));
    }
    
    /**
     * Engine with the same configuration and listener and an independent random stream.
     */
    public VariationEngine fork() {
        return new VariationEngine(config, rng.split(), listener);
    }
    
    // ========== Operators ==========
    
    /**
     * Apply any operator.
     * 
     * @param second donor parent; ignored by mutations, required by recombinations
     * @throws IllegalArgumentException if a recombination is given no second parent
     */
    public Individual apply(GeneticOperator operator, Individual first, Individual second) {
        Objects.requireNonNull(first, "first");
        if (!operator.isRecombination()) {
            return mutations.get(operator).mutate(first);
        }
        if (second == null) {
            throw new IllegalArgumentException(operator + " needs two parents");
        }
        return recombinations.get(operator).recombine(first, second);
    }
    
    public Individual mutate(Individual parent) {
        return apply(GeneticOperator.MUTATION, parent, null);
    }
    
    public Individual delete(Individual parent) {
        return apply(GeneticOperator.DELETION, parent, null);
    }
    
    public Individual addParentheses(Individual parent) {
        return apply(GeneticOperator.ADD_PARENTHESES, parent, null);
    }
    
    public Individual tag(Individual parent) {
        return apply(GeneticOperator.TAGGING, parent, null);
    }
    
    public Individual insertTagBranch(Individual parent) {
        return apply(GeneticOperator.TAG_BRANCH_INSERTION, parent, null);
    }
    
    public Individual gaussianMutate(Individual parent) {
        return apply(GeneticOperator.GAUSSIAN, parent, null);
    }
    
    public Individual crossover(Individual first, Individual second) {
        return apply(GeneticOperator.CROSSOVER, first, second);
    }
    
    public Individual booleanGsxover(Individual first, Individual second) {
        return apply(GeneticOperator.BOOLEAN_GSXOVER, first, second);
    }
    
    public Individual ultra(Individual first, Individual second) {
        return apply(GeneticOperator.ULTRA, first, second);
    }
    
    // ========== Accessors ==========
    
    public VariationConfig getConfig() {
        return config;
    }
    
    public long getSeed() {
        return rng.getInitialSeed();
    }
}
