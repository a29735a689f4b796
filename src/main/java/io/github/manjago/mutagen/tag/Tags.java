package io.github.manjago.mutagen.tag;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.Program;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming of tag instructions.
 * <ul>
 *   <li>{@code tag_exec_N}: stores the following code under tag N</li>
 *   <li>{@code tagged_N}: stands for the code stored under tag N</li>
 * </ul>
 */
public final class Tags {
    
    public static final String WRITE_PREFIX = "tag_exec_";
    public static final String REFERENCE_PREFIX = "tagged_";
    
    private static final Pattern WRITE_PATTERN = Pattern.compile(WRITE_PREFIX + "(\\d+)");
    private static final Pattern REFERENCE_PATTERN = Pattern.compile(REFERENCE_PREFIX + "(\\d+)");
    
    private Tags() {
        // Utility class
    }
    
    public static Atom write(int tag) {
        return Atom.instruction(WRITE_PREFIX + requireTag(tag));
    }
    
    public static Atom reference(int tag) {
        return Atom.instruction(REFERENCE_PREFIX + requireTag(tag));
    }
    
    /**
     * Tag written by {@code program}, if it is a {@code tag_exec_N} instruction.
     */
    public static OptionalInt writtenTag(Program program) {
        return match(WRITE_PATTERN, program);
    }
    
    /**
     * Tag referenced by {@code program}, if it is a {@code tagged_N} instruction.
     */
    public static OptionalInt referencedTag(Program program) {
        return match(REFERENCE_PATTERN, program);
    }
    
    private static OptionalInt match(Pattern pattern, Program program) {
        if (!(program instanceof Atom atom) || !atom.isInstruction()) {
            return OptionalInt.empty();
        }
        Matcher m = pattern.matcher(atom.name());
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            // Digits beyond int range: not a tag this engine could have written
            return OptionalInt.empty();
        }
    }
    
    private static int requireTag(int tag) {
        if (tag < 0) {
            throw new IllegalArgumentException("Tag must be non-negative: " + tag);
        }
        return tag;
    }
}
