package io.github.manjago.mutagen.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A candidate solution: a program plus its lineage and history.
 * 
 * Individuals are never modified. Variation operators return a new individual,
 * or the parent itself when the child is rejected.
 * 
 * @param program   the program
 * @param ancestors ancestor programs, most recent first
 * @param history   opaque per-generation data owned by the evolutionary loop
 */
public record Individual(Program program, List<Program> ancestors, List<Double> history) {
    
    public Individual {
        Objects.requireNonNull(program, "program");
        ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
        history = history == null ? List.of() : List.copyOf(history);
    }
    
    /**
     * Individual with no lineage and no history.
     */
    public static Individual of(Program program) {
        return new Individual(program, List.of(), List.of());
    }
    
    /**
     * Child individual holding {@code program}, inheriting this individual's history.
     * 
     * @param trackAncestry if true, this individual's program is prepended to the lineage
     */
    public Individual child(Program program, boolean trackAncestry) {
        List<Program> lineage = ancestors;
        if (trackAncestry) {
            lineage = new ArrayList<>(ancestors.size() + 1);
            lineage.add(this.program);
            lineage.addAll(ancestors);
        }
        return new Individual(program, lineage, history);
    }
    
    /**
     * Program size in points.
     */
    public int points() {
        return program.points();
    }
}
