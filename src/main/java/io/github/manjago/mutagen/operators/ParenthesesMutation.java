package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramReader;
import io.github.manjago.mutagen.core.ProgramReader.ProgramParseException;
import io.github.manjago.mutagen.core.ProgramWriter;
import io.github.manjago.mutagen.core.UniformSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds one pair of parentheses somewhere in the program.
 * 
 * Works on the written form: two distinct spaces are chosen, and the text strictly
 * between them is wrapped in a new pair. A program with fewer than two spaces is
 * left as it is.
 * <pre>
 *   (a b (c d))  spaces at 2, 4, 7  choose 2 and 7  ->  (a ( b (c ) d))
 * </pre>
 * The new bracket opens before it closes and the outer list still spans the whole
 * text, so the result always reads back as a single program.
 */
public class ParenthesesMutation implements Mutation {
    
    private static final Logger log = LoggerFactory.getLogger(ParenthesesMutation.class);
    
    private final UniformSource rng;
    private final int maxPoints;
    private final CommitPolicy policy;
    private final ProgramReader reader = new ProgramReader();
    
    public ParenthesesMutation(UniformSource rng, int maxPoints, CommitPolicy policy) {
        this.rng = rng;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program program = parent.program();
        String text = ProgramWriter.write(program);
        List<Integer> spaces = spaceIndices(text);
        
        if (spaces.size() < 2) {
            log.debug("No room for parentheses in {}", text);
            return policy.commit(GeneticOperator.ADD_PARENTHESES, parent, program, maxPoints);
        }
        
        int i = rng.pick(spaces);
        List<Integer> others = new ArrayList<>(spaces);
        others.remove(Integer.valueOf(i));
        int j = rng.pick(others);
        int start = Math.min(i, j);
        int stop = Math.max(i, j);
        
        String wrapped = text.substring(0, start)
                + " ( " + text.substring(start + 1, stop) + " ) "
                + text.substring(stop + 1);
        
        Program candidate;
        try {
            candidate = reader.read(wrapped);
        } catch (ProgramParseException e) {
            throw new IllegalStateException("Parenthesized text does not read back: " + wrapped, e);
        }
        return policy.commit(GeneticOperator.ADD_PARENTHESES, parent, candidate, maxPoints);
    }
    
    private static List<Integer> spaceIndices(String text) {
        List<Integer> spaces = new ArrayList<>();
        for (int k = 0; k < text.length(); k++) {
            if (text.charAt(k) == ' ') {
                spaces.add(k);
            }
        }
        return spaces;
    }
}
