package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.Marker;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.Token;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Conversion between programs and linear token streams.
 * <pre>
 *   (1 2 (a b (c) ((d)) e))
 *   ( 1 2 ( a b ( c ) ( ( d ) ) e ) )
 * </pre>
 */
public final class TokenStreams {
    
    private TokenStreams() {
        // Utility class
    }
    
    /**
     * Flatten a program: every list becomes OPEN, its flattened items, CLOSE.
     * An atom flattens to itself.
     */
    @Contract(pure = true)
    public static @NotNull List<Token> flatten(@NotNull Program program) {
        List<Token> tokens = new ArrayList<>();
        appendTokens(program, tokens);
        return tokens;
    }
    
    private static void appendTokens(Program program, List<Token> sink) {
        if (program instanceof Atom atom) {
            sink.add(atom);
            return;
        }
        sink.add(Marker.OPEN);
        for (Program item : ((ProgramList) program).items()) {
            appendTokens(item, sink);
        }
        sink.add(Marker.CLOSE);
    }
    
    /**
     * Rebuild a program from a well-formed token stream.
     * 
     * Top-level elements are collected into a list. If there is exactly one, it is
     * returned on its own, so {@code reconstruct(flatten(p))} gives back {@code p}.
     * An empty stream is the empty program and EMPTY_GROUP is an empty list.
     * 
     * @throws IllegalArgumentException if the brackets do not balance
     */
    @Contract(pure = true)
    public static @NotNull Program reconstruct(@NotNull List<? extends Token> tokens) {
        Deque<List<Program>> open = new ArrayDeque<>();
        open.push(new ArrayList<>());
        
        for (Token token : tokens) {
            if (token == Marker.OPEN) {
                open.push(new ArrayList<>());
            } else if (token == Marker.CLOSE) {
                if (open.size() == 1) {
                    throw new IllegalArgumentException("Unmatched CLOSE in token stream");
                }
                ProgramList list = new ProgramList(open.pop());
                open.peek().add(list);
            } else if (token == Marker.EMPTY_GROUP) {
                open.peek().add(ProgramList.EMPTY);
            } else {
                open.peek().add((Atom) token);
            }
        }
        if (open.size() != 1) {
            throw new IllegalArgumentException("Unmatched OPEN in token stream");
        }
        
        List<Program> top = open.pop();
        return top.size() == 1 ? top.get(0) : new ProgramList(top);
    }
    
    /**
     * True if every prefix has at least as many OPEN as CLOSE tokens and the totals match.
     */
    @Contract(pure = true)
    public static boolean isWellFormed(@NotNull List<? extends Token> tokens) {
        int depth = 0;
        for (Token token : tokens) {
            if (token == Marker.OPEN) {
                depth++;
            } else if (token == Marker.CLOSE) {
                if (--depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
    
    /**
     * Program with every empty list removed, innermost first, so lists that only held
     * empty lists disappear too. The root itself may end up empty.
     */
    @Contract(pure = true)
    public static @NotNull Program removeEmpties(@NotNull Program program) {
        if (!(program instanceof ProgramList list)) {
            return program;
        }
        List<Program> kept = new ArrayList<>(list.size());
        for (Program item : list.items()) {
            Program cleaned = removeEmpties(item);
            if (!(cleaned instanceof ProgramList sub && sub.isEmpty())) {
                kept.add(cleaned);
            }
        }
        return new ProgramList(kept);
    }
}
