package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Marker;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.ProgramWriter;
import io.github.manjago.mutagen.core.Token;
import io.github.manjago.mutagen.core.UniformSource;
import io.github.manjago.mutagen.random.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ULTRA: Uniform Linear Transformation with Repair and Alternation.
 * 
 * <ol>
 *   <li>Pad the shorter parent's top-level list with empty lists</li>
 *   <li>Flatten both parents to token streams</li>
 *   <li>Alternate between the streams, drifting the read position by Gaussian noise
 *       on every switch</li>
 *   <li>Replace tokens at random with vocabulary atoms or brackets</li>
 *   <li>Repair the brackets</li>
 *   <li>Rebuild the tree and drop empty lists</li>
 * </ol>
 * If either parent is a bare atom, the child is a copy of the first parent's program.
 */
public class Ultra implements Recombination {
    
    private static final Logger log = LoggerFactory.getLogger(Ultra.class);
    
    /** Alternation stops once the child stream grows beyond this many tokens. */
    static final int MAX_ALTERNATION_TOKENS = 10_000;
    
    private static final Marker[] EXTRA_TOKENS = {Marker.OPEN, Marker.CLOSE, Marker.EMPTY_GROUP};
    
    private final UniformSource rng;
    private final Vocabulary vocabulary;
    private final double alternationRate;
    private final double alignmentDeviation;
    private final double mutationRate;
    private final int maxPoints;
    private final CommitPolicy policy;
    private final BalanceRepair repair;
    
    public Ultra(UniformSource rng, Vocabulary vocabulary, double alternationRate,
                 double alignmentDeviation, double mutationRate, int maxPoints, CommitPolicy policy) {
        this.rng = rng;
        this.vocabulary = vocabulary;
        this.alternationRate = alternationRate;
        this.alignmentDeviation = alignmentDeviation;
        this.mutationRate = mutationRate;
        this.maxPoints = maxPoints;
        this.policy = policy;
        this.repair = new BalanceRepair(rng);
    }
    
    @Override
    public Individual recombine(Individual first, Individual second) {
        Program candidate = operate(first.program(), second.program());
        return policy.commit(GeneticOperator.ULTRA, first, candidate, maxPoints);
    }
    
    /**
     * The ULTRA child program of two parent programs.
     */
    Program operate(Program p1, Program p2) {
        if (!(p1 instanceof ProgramList l1) || !(p2 instanceof ProgramList l2)) {
            log.debug("ULTRA needs two lists, keeping first parent {}", ProgramWriter.write(p1));
            return p1;
        }
        int length = Math.max(l1.size(), l2.size());
        List<Token> s1 = TokenStreams.flatten(pad(l1, length));
        List<Token> s2 = TokenStreams.flatten(pad(l2, length));
        
        List<Token> child = alternate(s1, s2);
        child = linearlyMutate(child);
        child = repair.balance(child);
        return TokenStreams.removeEmpties(TokenStreams.reconstruct(child));
    }
    
    private static ProgramList pad(ProgramList list, int length) {
        if (list.size() >= length) {
            return list;
        }
        List<Program> padded = new ArrayList<>(list.items());
        while (padded.size() < length) {
            padded.add(ProgramList.EMPTY);
        }
        return new ProgramList(padded);
    }
    
    /**
     * Walk the two streams, copying tokens from the current one. With probability
     * {@code alternationRate} a step switches streams and shifts the position by
     * {@code round(alignmentDeviation * N(0,1))} (never below 0) instead of copying.
     */
    List<Token> alternate(List<Token> s1, List<Token> s2) {
        List<Token> result = new ArrayList<>();
        boolean useFirst = rng.nextBoolean();
        long i = 0;
        while (true) {
            List<Token> source = useFirst ? s1 : s2;
            if (i >= source.size() || result.size() > MAX_ALTERNATION_TOKENS) {
                return result;
            }
            if (rng.nextBoolean(alternationRate)) {
                i = Math.max(0, i + Math.round(alignmentDeviation * rng.nextGaussian()));
                useFirst = !useFirst;
            } else {
                result.add(source.get((int) i));
                i++;
            }
        }
    }
    
    /**
     * Replace each token, with probability {@code mutationRate}, by a token drawn
     * uniformly from the vocabulary plus OPEN, CLOSE and EMPTY_GROUP.
     */
    List<Token> linearlyMutate(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            result.add(rng.nextBoolean(mutationRate) ? randomToken() : token);
        }
        return result;
    }
    
    private Token randomToken() {
        int choice = rng.nextInt(vocabulary.size() + EXTRA_TOKENS.length);
        if (choice < vocabulary.size()) {
            return vocabulary.get(choice).generate(rng);
        }
        return EXTRA_TOKENS[choice - vocabulary.size()];
    }
}
