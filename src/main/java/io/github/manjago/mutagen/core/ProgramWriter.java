package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Writes programs and token streams as parenthesized text.
 * <p>
 * Lists print as {@code (a b c)} with a single space between elements, so the text
 * can be read back by {@link ProgramReader}.
 */
public final class ProgramWriter {
    
    private ProgramWriter() {
        // Utility class
    }
    
    /**
     * Write a program, e.g. {@code (integer_add 1 (2.5 true))}.
     */
    public static @NotNull String write(@NotNull Program program) {
        StringBuilder sb = new StringBuilder();
        append(program, sb);
        return sb.toString();
    }
    
    private static void append(Program program, StringBuilder sb) {
        if (program instanceof Atom atom) {
            sb.append(atom);
            return;
        }
        sb.append('(');
        List<Program> items = ((ProgramList) program).items();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            append(items.get(i), sb);
        }
        sb.append(')');
    }
    
    /**
     * Write a token stream with markers shown as {@code ( ) ()}, space separated.
     */
    public static @NotNull String write(@NotNull List<? extends Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(token instanceof Marker marker ? marker.getText() : token.toString());
        }
        return sb.toString();
    }
}
