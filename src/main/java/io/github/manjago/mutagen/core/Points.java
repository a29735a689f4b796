package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Node addressing over programs.
 * 
 * Every node (atom or list) has an index in depth-first pre-order traversal.
 * Index 0 is the program itself:
 * <pre>
 *   (a b (c d))
 *   0: (a b (c d))   1: a   2: b   3: (c d)   4: c   5: d
 * </pre>
 * All operations are pure. Rebuilt programs share every untouched subtree with the input.
 */
public final class Points {
    
    private Points() {
        // Utility class
    }
    
    /**
     * Number of addressable nodes.
     */
    @Contract(pure = true)
    public static int count(@NotNull Program program) {
        return program.points();
    }
    
    /**
     * Node at traversal index {@code index}.
     * 
     * @throws IndexOutOfBoundsException if index is not in [0, count)
     */
    @Contract(pure = true)
    public static @NotNull Program nodeAt(@NotNull Program program, int index) {
        Objects.checkIndex(index, program.points());
        
        Program node = program;
        int remaining = index;
        while (remaining > 0) {
            remaining--;  // step past the list node itself
            for (Program child : ((ProgramList) node).items()) {
                if (remaining < child.points()) {
                    node = child;
                    break;
                }
                remaining -= child.points();
            }
        }
        return node;
    }
    
    /**
     * Program with the node at {@code index} replaced by {@code replacement}.
     * Replacing index 0 returns the replacement itself.
     */
    @Contract(pure = true)
    public static @NotNull Program replaceNodeAt(@NotNull Program program, int index,
                                                 @NotNull Program replacement) {
        Objects.checkIndex(index, program.points());
        Objects.requireNonNull(replacement, "replacement");
        return replace(program, index, replacement);
    }
    
    private static Program replace(Program node, int index, Program replacement) {
        if (index == 0) {
            return replacement;
        }
        ProgramList list = (ProgramList) node;
        int offset = index - 1;
        for (int k = 0; k < list.size(); k++) {
            Program child = list.get(k);
            if (offset < child.points()) {
                return list.with(k, replace(child, offset, replacement));
            }
            offset -= child.points();
        }
        throw new IllegalStateException("Index " + index + " not found in " + node);
    }
    
    /**
     * Program with the node at {@code index} removed from its parent list.
     * 
     * A list left empty by the removal loses its own slot as well, up to (but not
     * including) the root. The root has no parent list, so index 0 returns the program as is.
     */
    @Contract(pure = true)
    public static @NotNull Program removeNodeAt(@NotNull Program program, int index) {
        Objects.checkIndex(index, program.points());
        if (index == 0) {
            return program;
        }
        return remove((ProgramList) program, index);
    }
    
    private static ProgramList remove(ProgramList list, int index) {
        int offset = index - 1;
        for (int k = 0; k < list.size(); k++) {
            Program child = list.get(k);
            if (offset < child.points()) {
                if (offset == 0) {
                    return list.without(k);
                }
                ProgramList shrunk = remove((ProgramList) child, offset);
                return shrunk.isEmpty() ? list.without(k) : list.with(k, shrunk);
            }
            offset -= child.points();
        }
        throw new IllegalStateException("Index " + index + " not found in " + list);
    }
    
    /**
     * Program with the list at {@code index} un-nested: its children are spliced into
     * the parent list in its place. Collapsing the root returns the program unchanged.
     * 
     * @throws IllegalArgumentException if the addressed node is an atom
     */
    @Contract(pure = true)
    public static @NotNull Program collapseBracketsAt(@NotNull Program program, int index) {
        Program target = nodeAt(program, index);
        if (!target.isList()) {
            throw new IllegalArgumentException("Node " + index + " is an atom: " + target);
        }
        if (index == 0) {
            return program;
        }
        return collapse((ProgramList) program, index);
    }
    
    private static ProgramList collapse(ProgramList list, int index) {
        int offset = index - 1;
        for (int k = 0; k < list.size(); k++) {
            Program child = list.get(k);
            if (offset < child.points()) {
                if (offset == 0) {
                    List<Program> spliced = new ArrayList<>(list.items().subList(0, k));
                    spliced.addAll(((ProgramList) child).items());
                    spliced.addAll(list.items().subList(k + 1, list.size()));
                    return new ProgramList(spliced);
                }
                return list.with(k, collapse((ProgramList) child, offset));
            }
            offset -= child.points();
        }
        throw new IllegalStateException("Index " + index + " not found in " + list);
    }
    
    /**
     * Program of the same shape with every atom passed through {@code mapper}.
     */
    public static @NotNull Program mapAtoms(@NotNull Program program, @NotNull UnaryOperator<Atom> mapper) {
        if (program instanceof Atom atom) {
            return mapper.apply(atom);
        }
        List<Program> items = ((ProgramList) program).items();
        List<Program> mapped = new ArrayList<>(items.size());
        for (Program item : items) {
            mapped.add(mapAtoms(item, mapper));
        }
        return new ProgramList(mapped);
    }
    
    /**
     * All atoms in traversal order.
     */
    @Contract(pure = true)
    public static @NotNull List<Atom> atoms(@NotNull Program program) {
        List<Atom> atoms = new ArrayList<>();
        collectAtoms(program, atoms);
        return atoms;
    }
    
    private static void collectAtoms(Program program, List<Atom> sink) {
        if (program instanceof Atom atom) {
            sink.add(atom);
            return;
        }
        for (Program item : ((ProgramList) program).items()) {
            collectAtoms(item, sink);
        }
    }
    
    /**
     * Traversal indices of every leaf (atom or empty list) or of every non-empty list.
     */
    @Contract(pure = true)
    public static @NotNull List<Integer> indicesOf(@NotNull Program program, boolean leaves) {
        List<Integer> indices = new ArrayList<>();
        collectIndices(program, 0, leaves, indices);
        return indices;
    }
    
    private static void collectIndices(Program node, int index, boolean leaves, List<Integer> sink) {
        boolean isLeaf = !node.isList() || ((ProgramList) node).isEmpty();
        if (isLeaf == leaves) {
            sink.add(index);
        }
        if (node instanceof ProgramList list) {
            int childIndex = index + 1;
            for (Program child : list.items()) {
                collectIndices(child, childIndex, leaves, sink);
                childIndex += child.points();
            }
        }
    }
}
