package io.github.manjago.mutagen.core;

/**
 * A Push-style program: either an {@link Atom} or an ordered {@link ProgramList} of programs.
 * 
 * Programs are immutable values. Every variation operator builds a new program and
 * shares untouched subtrees with its input.
 */
public interface Program {
    
    /**
     * Number of points (nodes) in this program, counting every atom and every list,
     * including this one.
     */
    int points();
    
    /**
     * @return true for a {@link ProgramList}, false for an {@link Atom}
     */
    boolean isList();
}
