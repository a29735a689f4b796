package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Marker;
import io.github.manjago.mutagen.core.Token;
import io.github.manjago.mutagen.core.UniformSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Randomized repair of unbalanced token streams.
 * 
 * A left-to-right pass fixes every unmatched CLOSE. With even odds it either deletes a
 * CLOSE chosen uniformly from the scanned prefix plus the offending one, or inserts an
 * OPEN at a uniform position of the scanned prefix. The same pass over the reversed
 * stream with the roles swapped fixes unmatched OPENs.
 */
public final class BalanceRepair {
    
    private static final Logger log = LoggerFactory.getLogger(BalanceRepair.class);
    
    private final UniformSource rng;
    
    public BalanceRepair(UniformSource rng) {
        this.rng = rng;
    }
    
    /**
     * Well-formed version of {@code tokens}.
     */
    public List<Token> balance(List<? extends Token> tokens) {
        List<Token> work = leftBalance(tokens, Marker.OPEN);
        Collections.reverse(work);
        work = leftBalance(work, Marker.CLOSE);
        Collections.reverse(work);
        return work;
    }
    
    /**
     * Repair every {@code left.mirror()} that has no earlier unmatched {@code left}.
     * 
     * After a repair the scan restarts at the edited position rather than at 0. The
     * prefix before an edit had no unmatched {@code right}, so rescanning it would draw
     * no random numbers and rebuild the same depth; the recorded depth is reused instead.
     */
    List<Token> leftBalance(List<? extends Token> tokens, Marker left) {
        Marker right = left.mirror();
        List<Token> seq = new ArrayList<>(tokens);
        // depthBefore.get(k): unmatched lefts before position k
        List<Integer> depthBefore = new ArrayList<>(seq.size());
        int depth = 0;
        int pos = 0;
        int repairs = 0;
        
        while (pos < seq.size()) {
            depthBefore.add(depth);
            Token token = seq.get(pos);
            
            if (token == left) {
                depth++;
                pos++;
            } else if (token == right && depth > 0) {
                depth--;
                pos++;
            } else if (token == right) {
                int edit = rng.nextBoolean(0.5)
                        ? deleteSomewhere(seq, right, pos)
                        : insertSomewhere(seq, left, pos);
                repairs++;
                // Resume at the edit with the depth the untouched prefix had there
                pos = edit;
                depth = depthBefore.get(edit);
                depthBefore.subList(edit, depthBefore.size()).clear();
            } else {
                pos++;
            }
        }
        if (repairs > 0) {
            log.debug("Repaired {} unmatched {} in a stream of {} tokens", repairs, right, seq.size());
        }
        return seq;
    }
    
    /**
     * Delete one {@code marker} chosen uniformly among positions [0, upTo].
     * @return the position of the deletion
     */
    private int deleteSomewhere(List<Token> seq, Marker marker, int upTo) {
        List<Integer> locations = new ArrayList<>();
        for (int k = 0; k <= upTo; k++) {
            if (seq.get(k) == marker) {
                locations.add(k);
            }
        }
        int location = rng.pick(locations);
        seq.remove(location);
        return location;
    }
    
    /**
     * Insert {@code marker} at a uniform position in [0, prefixLength].
     * @return the position of the insertion
     */
    private int insertSomewhere(List<Token> seq, Marker marker, int prefixLength) {
        int at = rng.nextInt(prefixLength + 1);
        seq.add(at, marker);
        return at;
    }
}
