package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.UniformSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable list of atom generators that random code is drawn from.
 * Each generator is equally likely to be chosen.
 */
public final class Vocabulary {
    
    private final List<AtomGenerator> generators;
    
    public Vocabulary(List<AtomGenerator> generators) {
        if (generators.isEmpty()) {
            throw new IllegalArgumentException("Vocabulary must not be empty");
        }
        this.generators = List.copyOf(generators);
    }
    
    /**
     * Vocabulary of plain instructions.
     */
    public static Vocabulary instructions(String... names) {
        return instructions(Arrays.asList(names));
    }
    
    public static Vocabulary instructions(List<String> names) {
        List<AtomGenerator> generators = new ArrayList<>(names.size());
        for (String name : names) {
            generators.add(AtomGenerator.constant(Atom.instruction(name)));
        }
        return new Vocabulary(generators);
    }
    
    /**
     * Copy with extra generators appended.
     */
    public Vocabulary with(AtomGenerator... extra) {
        List<AtomGenerator> all = new ArrayList<>(generators);
        all.addAll(Arrays.asList(extra));
        return new Vocabulary(all);
    }
    
    public int size() {
        return generators.size();
    }
    
    public AtomGenerator get(int index) {
        return generators.get(index);
    }
    
    /**
     * One atom from a uniformly chosen generator.
     */
    public Atom randomAtom(UniformSource rng) {
        return rng.pick(generators).generate(rng);
    }
    
    @Override
    public String toString() {
        return "Vocabulary" + generators;
    }
}
