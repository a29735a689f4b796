package io.github.manjago.mutagen.core;

/**
 * Kinds of leaf values a program can hold.
 */
public enum AtomType {
    INSTRUCTION,
    INTEGER,
    FLOAT,
    BOOLEAN
}
