package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Indivisible program leaf: an instruction symbol, an integer, a float or a boolean.
 * 
 * The value is a {@link String} for instructions, {@link Long} for integers,
 * {@link Double} for floats and {@link Boolean} for booleans.
 */
public record Atom(AtomType type, Object value) implements Program, Token {
    
    // Instruction names must survive a write/read round trip
    private static final Pattern NAME_PATTERN = Pattern.compile("[^\\s()]+");
    
    static final Pattern INTEGER_PATTERN = Pattern.compile("-?\\d+");
    static final Pattern FLOAT_PATTERN =
            Pattern.compile("-?(\\d+\\.\\d*([eE][-+]?\\d+)?|\\d+[eE][-+]?\\d+)");
    
    public Atom {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        Class<?> expected = switch (type) {
            case INSTRUCTION -> String.class;
            case INTEGER -> Long.class;
            case FLOAT -> Double.class;
            case BOOLEAN -> Boolean.class;
        };
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Atom of type " + type + " cannot hold " + value.getClass().getSimpleName());
        }
        if (type == AtomType.INSTRUCTION) {
            String name = (String) value;
            if (!NAME_PATTERN.matcher(name).matches() || isLiteral(name)) {
                throw new IllegalArgumentException("Invalid instruction name: '" + name + "'");
            }
        }
        if (type == AtomType.FLOAT && !Double.isFinite((Double) value)) {
            // No literal form reads back as a float
            throw new IllegalArgumentException("Float must be finite: " + value);
        }
    }
    
    /**
     * True if {@code text} reads as an integer, float or boolean literal.
     */
    static boolean isLiteral(String text) {
        return text.equals("true") || text.equals("false")
                || INTEGER_PATTERN.matcher(text).matches()
                || FLOAT_PATTERN.matcher(text).matches();
    }
    
    // ========== Factories ==========
    
    @Contract(pure = true)
    public static @NotNull Atom instruction(String name) {
        return new Atom(AtomType.INSTRUCTION, name);
    }
    
    @Contract(pure = true)
    public static @NotNull Atom integer(long value) {
        return new Atom(AtomType.INTEGER, value);
    }
    
    @Contract(pure = true)
    public static @NotNull Atom floating(double value) {
        return new Atom(AtomType.FLOAT, value);
    }
    
    @Contract(pure = true)
    public static @NotNull Atom bool(boolean value) {
        return new Atom(AtomType.BOOLEAN, value);
    }
    
    // ========== Accessors ==========
    
    @Override
    public int points() {
        return 1;
    }
    
    @Override
    public boolean isList() {
        return false;
    }
    
    public boolean isInstruction() {
        return type == AtomType.INSTRUCTION;
    }
    
    public boolean isFloat() {
        return type == AtomType.FLOAT;
    }
    
    /**
     * Instruction name.
     * @throws IllegalStateException if this atom is not an instruction
     */
    public String name() {
        if (type != AtomType.INSTRUCTION) {
            throw new IllegalStateException("Not an instruction: " + this);
        }
        return (String) value;
    }
    
    /**
     * Float value.
     * @throws IllegalStateException if this atom is not a float
     */
    public double doubleValue() {
        if (type != AtomType.FLOAT) {
            throw new IllegalStateException("Not a float: " + this);
        }
        return (Double) value;
    }
    
    /**
     * Literal text as it appears in a written program.
     */
    @Override
    public String toString() {
        return value.toString();
    }
}
