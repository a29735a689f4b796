package io.github.manjago.mutagen.core;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable sequence of programs.
 * 
 * The point count is computed once at construction, so node addressing can skip
 * whole subtrees without re-walking them.
 */
public final class ProgramList implements Program {
    
    /** The empty program {@code ()}. */
    public static final ProgramList EMPTY = new ProgramList(List.of());
    
    private final List<Program> items;
    private final int points;
    
    public ProgramList(List<? extends Program> items) {
        this.items = List.copyOf(items);
        int total = 1;
        for (Program item : this.items) {
            total += item.points();
        }
        this.points = total;
    }
    
    public static ProgramList of(Program... items) {
        return new ProgramList(List.of(items));
    }
    
    public List<Program> items() {
        return items;
    }
    
    public int size() {
        return items.size();
    }
    
    public boolean isEmpty() {
        return items.isEmpty();
    }
    
    public Program get(int index) {
        return items.get(index);
    }
    
    /**
     * Copy with one element replaced.
     */
    public ProgramList with(int index, Program item) {
        List<Program> copy = new ArrayList<>(items);
        copy.set(index, item);
        return new ProgramList(copy);
    }
    
    /**
     * Copy with an element inserted before {@code index} (0..size).
     */
    public ProgramList inserting(int index, Program item) {
        List<Program> copy = new ArrayList<>(items);
        copy.add(index, item);
        return new ProgramList(copy);
    }
    
    /**
     * Copy with one element removed.
     */
    public ProgramList without(int index) {
        List<Program> copy = new ArrayList<>(items);
        copy.remove(index);
        return new ProgramList(copy);
    }
    
    @Override
    public int points() {
        return points;
    }
    
    @Override
    public boolean isList() {
        return true;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgramList other)) return false;
        return points == other.points && items.equals(other.items);
    }
    
    @Override
    public int hashCode() {
        return items.hashCode();
    }
    
    @Override
    public String toString() {
        return items.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" ", "(", ")"));
    }
}
