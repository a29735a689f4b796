package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.UniformSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Random code generator.
 * 
 * Picks a size uniformly in [1, maxPoints]. Size 1 is a single atom; a larger size
 * becomes a list whose children split the remaining {@code size - 1} points in a
 * random decomposition, shuffled, each child generated the same way.
 */
public class RandomCodeGenerator implements CodeGenerator {
    
    private final UniformSource rng;
    
    public RandomCodeGenerator(UniformSource rng) {
        this.rng = rng;
    }
    
    @Override
    public Program generate(int maxPoints, Vocabulary vocabulary) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be positive: " + maxPoints);
        }
        return generateWithSize(1 + rng.nextInt(maxPoints), vocabulary);
    }
    
    /**
     * Random program of exactly {@code points} points.
     */
    public Program generateWithSize(int points, Vocabulary vocabulary) {
        if (points < 2) {
            return vocabulary.randomAtom(rng);
        }
        List<Integer> sizes = decompose(points - 1, points - 1);
        shuffle(sizes);
        List<Program> children = new ArrayList<>(sizes.size());
        for (int size : sizes) {
            children.add(generateWithSize(size, vocabulary));
        }
        return new ProgramList(children);
    }
    
    /**
     * Random split of {@code number} into at most {@code maxParts} positive parts.
     */
    List<Integer> decompose(int number, int maxParts) {
        List<Integer> parts = new ArrayList<>();
        int remaining = number;
        int partsLeft = maxParts;
        while (remaining > 1 && partsLeft > 1) {
            int part = 1 + rng.nextInt(remaining - 1);
            parts.add(part);
            remaining -= part;
            partsLeft--;
        }
        parts.add(remaining);
        return parts;
    }
    
    // Fisher-Yates over the injected source so seeded runs stay reproducible
    private void shuffle(List<Integer> values) {
        for (int i = values.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            values.set(j, values.set(i, values.get(j)));
        }
    }
}
