package io.github.manjago.mutagen.operators;

import java.util.Objects;

/**
 * A stack type paired with the instruction that compares two values of that type,
 * e.g. {@code integer} / {@code integer_eq}.
 */
public record TypeComparison(String type, String equalityInstruction) {
    
    public TypeComparison {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(equalityInstruction, "equalityInstruction");
    }
    
    /**
     * Instruction that copies a value of this type from deeper in its stack without popping it.
     */
    public String yankdupInstruction() {
        return type + "_yankdup";
    }
}
